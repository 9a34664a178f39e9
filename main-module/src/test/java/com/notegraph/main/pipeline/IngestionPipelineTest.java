package com.notegraph.main.pipeline;

import com.notegraph.common.exception.ValidationException;
import com.notegraph.common.model.BacklinkEntry;
import com.notegraph.common.model.BacklinksIndex;
import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.NoteType;
import com.notegraph.main.InMemoryGraphFixture;
import com.notegraph.main.config.GraphProperties;
import com.notegraph.main.embedding.EmbeddingProvider;
import com.notegraph.main.exception.EmbeddingProviderException;
import com.notegraph.main.graph.GraphMaintainer;
import com.notegraph.main.note.NoteFactory;
import com.notegraph.main.note.TimestampHashNoteIdGenerator;
import com.notegraph.main.similarity.SimilarityEngine;
import com.notegraph.storage.exception.RetryExhaustedException;
import com.notegraph.storage.exception.VersionConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit-тесты для IngestionPipeline на in-memory хранилище
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IngestionPipelineTest {

    private static final Instant NOW = Instant.parse("2026-02-22T15:30:45Z");
    private static final String EMBEDDINGS_PATH = "index/embeddings.json";
    private static final String BACKLINKS_PATH = "index/backlinks.json";

    @Mock
    private EmbeddingProvider embeddingProvider;

    private InMemoryGraphFixture fixture;
    private IngestionPipeline pipeline;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        fixture = new InMemoryGraphFixture(clock);
        lenient().when(embeddingProvider.model()).thenReturn("test-model");
        pipeline = new IngestionPipeline(
                new NoteFactory(new TimestampHashNoteIdGenerator(), clock),
                embeddingProvider,
                new SimilarityEngine(),
                new GraphMaintainer(),
                fixture.indexRepository,
                fixture.noteRepository,
                new GraphProperties(),
                clock);
    }

    @Test
    @DisplayName("Первая нота: без связей, ровно три записи в хранилище")
    void firstNoteHasNoLinks() {
        when(embeddingProvider.embed(anyString())).thenReturn(Mono.just(new double[]{1.0, 0.0}));

        StepVerifier.create(pipeline.ingest("  The first idea  ", NoteType.HYPOTHESIS))
                .assertNext(result -> {
                    assertThat(result.noteId()).startsWith("20260222T153045-");
                    assertThat(result.type()).isEqualTo(NoteType.HYPOTHESIS);
                    assertThat(result.linkedNotes()).isEmpty();
                })
                .verifyComplete();

        verify(fixture.store, times(3)).put(anyString(), anyString(), any());
        assertThat(fixture.store.paths()).hasSize(3).contains("index/backlinks.json", "index/embeddings.json");
        verify(embeddingProvider).embed("The first idea");
    }

    @Test
    @DisplayName("Две ноты с одинаковым вектором связываются симметрично с similarity 1")
    void identicalVectorsAreLinked() {
        when(embeddingProvider.embed(anyString())).thenReturn(Mono.just(new double[]{0.6, 0.8}));

        String firstId = pipeline.ingest("first", null).block().noteId();
        IngestionResult second = pipeline.ingest("second", null).block();

        assertThat(second.linkedNotes()).hasSize(1);
        assertThat(second.linkedNotes().get(0).noteId()).isEqualTo(firstId);
        assertThat(second.linkedNotes().get(0).similarity()).isCloseTo(1.0, within(1e-9));

        BacklinksIndex backlinks = fixture.indexRepository.readBacklinks().block();
        assertThat(backlinks.linksOf(firstId)).extracting(BacklinkEntry::targetId).containsExactly(second.noteId());
        assertThat(backlinks.linksOf(second.noteId())).extracting(BacklinkEntry::targetId).containsExactly(firstId);
        assertThat(fixture.indexRepository.readEmbeddings().block().embeddings()).containsOnlyKeys(firstId, second.noteId());
    }

    @Test
    @DisplayName("Ошибка провайдера эмбеддингов: ничего не записано")
    void providerFailureWritesNothing() {
        when(embeddingProvider.embed(anyString()))
                .thenReturn(Mono.error(new EmbeddingProviderException("Embedding request failed (500)")));

        StepVerifier.create(pipeline.ingest("doomed", null))
                .expectError(EmbeddingProviderException.class)
                .verify();

        verify(fixture.store, never()).put(any(), any(), any());
        assertThat(fixture.store.paths()).isEmpty();
    }

    @Test
    @DisplayName("Пустой контент отклоняется до вызова провайдера")
    void emptyContentIsRejected() {
        StepVerifier.create(pipeline.ingest("\n\n  \n", null))
                .expectError(ValidationException.class)
                .verify();

        verify(embeddingProvider, never()).embed(any());
        verify(fixture.store, never()).put(any(), any(), any());
    }

    @Test
    @DisplayName("Повторный ingest того же текста в ту же секунду отклоняется без записей")
    void duplicateNoteIsRejected() {
        when(embeddingProvider.embed(anyString())).thenReturn(Mono.just(new double[]{0.6, 0.8}));
        String firstId = pipeline.ingest("same", null).block().noteId();
        BacklinksIndex backlinksBefore = fixture.indexRepository.readBacklinks().block();
        clearInvocations(fixture.store, embeddingProvider);

        StepVerifier.create(pipeline.ingest("same", null))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ValidationException.class)
                        .hasMessageContaining(firstId)
                        .hasMessageContaining("already exists"))
                .verify();

        verify(embeddingProvider, never()).embed(any());
        verify(fixture.store, never()).put(any(), any(), any());
        assertThat(fixture.indexRepository.readBacklinks().block()).isEqualTo(backlinksBefore);
        assertThat(fixture.indexRepository.readEmbeddings().block().embeddings()).containsOnlyKeys(firstId);
    }

    @Test
    @DisplayName("Исчерпание ретраев эмбеддингов: нота и симметричные связи сохраняются")
    void embeddingsExhaustionKeepsNoteAndBacklinks() {
        String seededId = "20260222T153044-0000000a";
        fixture.indexRepository.upsertEmbedding(
                new EmbeddingRecord(seededId, new double[]{1.0, 0.0}, "test-model", NOW)).block();
        clearInvocations(fixture.store);
        doReturn(Mono.error(new VersionConflictException(EMBEDDINGS_PATH, 409, "stale")))
                .when(fixture.store).put(eq(EMBEDDINGS_PATH), anyString(), any());
        when(embeddingProvider.embed(anyString())).thenReturn(Mono.just(new double[]{1.0, 0.0}));

        StepVerifier.create(pipeline.ingest("linked but not embedded", null))
                .expectError(RetryExhaustedException.class)
                .verify();

        BacklinksIndex backlinks = fixture.indexRepository.readBacklinks().block();
        List<String> newIds = backlinks.links().keySet().stream().filter(id -> !id.equals(seededId)).toList();
        assertThat(newIds).hasSize(1);
        String newId = newIds.get(0);
        assertThat(backlinks.linksOf(seededId)).extracting(BacklinkEntry::targetId).containsExactly(newId);
        assertThat(backlinks.linksOf(newId)).extracting(BacklinkEntry::targetId).containsExactly(seededId);

        String notePath = fixture.noteRepository.pathOf(newId);
        assertThat(fixture.store.paths()).contains(notePath);
        assertThat(fixture.noteRepository.find(newId).block()).isNotNull();
        assertThat(fixture.indexRepository.readEmbeddings().block().embeddings()).containsOnlyKeys(seededId);

        verify(fixture.store, times(fixture.properties.getRetry().getMaxAttempts()))
                .put(eq(EMBEDDINGS_PATH), anyString(), any());
        InOrder noteFirst = inOrder(fixture.store);
        noteFirst.verify(fixture.store).put(eq(notePath), anyString(), any());
        noteFirst.verify(fixture.store, atLeastOnce()).put(eq(EMBEDDINGS_PATH), anyString(), any());
        InOrder backlinksFirst = inOrder(fixture.store);
        backlinksFirst.verify(fixture.store).put(eq(BACKLINKS_PATH), anyString(), any());
        backlinksFirst.verify(fixture.store, atLeastOnce()).put(eq(EMBEDDINGS_PATH), anyString(), any());
    }
}
