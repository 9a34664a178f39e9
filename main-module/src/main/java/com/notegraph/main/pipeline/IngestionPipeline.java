package com.notegraph.main.pipeline;

import com.notegraph.common.exception.ValidationException;
import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.Note;
import com.notegraph.common.model.NoteType;
import com.notegraph.main.config.GraphProperties;
import com.notegraph.main.embedding.EmbeddingProvider;
import com.notegraph.main.graph.GraphMaintainer;
import com.notegraph.main.note.NoteFactory;
import com.notegraph.main.similarity.SimilarityEngine;
import com.notegraph.main.similarity.SimilarityMatch;
import com.notegraph.storage.index.IndexDocument;
import com.notegraph.storage.index.IndexRepository;
import com.notegraph.storage.exception.VersionConflictException;
import com.notegraph.storage.note.NoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Set;

/**
 * Creates a note end to end: build, embed, link, persist.
 * <p>
 * The note document and the backlinks update are written concurrently. The embeddings upsert runs only after
 * both succeed, as a separate retry-coordinated update, so an embeddings conflict can never block or undo
 * the note and its links. If that last step fails the note exists and is linked but stays invisible to
 * similarity scans until a full re-link pass repairs the embeddings index.
 * <p>
 * A note id is derived from the creation second and the content, so the same content ingested twice within
 * one second maps to an existing document. That case is rejected with {@link ValidationException} before
 * the provider is called or anything is written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final NoteFactory noteFactory;
    private final EmbeddingProvider embeddingProvider;
    private final SimilarityEngine similarityEngine;
    private final GraphMaintainer graphMaintainer;
    private final IndexRepository indexRepository;
    private final NoteRepository noteRepository;
    private final GraphProperties properties;
    private final Clock clock;

    public Mono<IngestionResult> ingest(String rawContent, NoteType type) {
        return Mono.fromCallable(() -> noteFactory.create(rawContent, type))
                .flatMap(note -> rejectExisting(note)
                        .then(Mono.defer(() -> embeddingProvider.embed(note.content())))
                        .flatMap(vector -> linkAndStore(note, vector)));
    }

    private Mono<Void> rejectExisting(Note note) {
        return noteRepository.find(note.id())
                .flatMap(existing -> Mono.<Void>error(alreadyExists(note.id())));
    }

    private static ValidationException alreadyExists(String noteId) {
        return new ValidationException("Note " + noteId + " already exists");
    }

    private Mono<IngestionResult> linkAndStore(Note draft, double[] vector) {
        return indexRepository.readEmbeddings()
                .map(embeddings -> similarityEngine.findMatches(vector, embeddings,
                        properties.getSimilarityThreshold(), Set.of(draft.id())))
                .flatMap(matches -> {
                    Note note = draft.withLinks(matches.stream().map(SimilarityMatch::toLink).toList());
                    EmbeddingRecord record = new EmbeddingRecord(note.id(), vector, embeddingProvider.model(), clock.instant());

                    Mono<String> writeNote = noteRepository.create(note)
                            .onErrorMap(VersionConflictException.class, conflict -> alreadyExists(note.id()));
                    Mono<?> writeBacklinks = indexRepository.update(IndexDocument.BACKLINKS, backlinks -> {
                        graphMaintainer.applyMatches(backlinks, note.id(), matches);
                        return backlinks;
                    });

                    return Mono.when(writeNote, writeBacklinks)
                            .then(indexRepository.upsertEmbedding(record))
                            .doOnSuccess(ignored -> log.info("Ingested note {} with {} links", note.id(), matches.size()))
                            .doOnError(error -> log.error("Ingestion of note {} failed: {}", note.id(), error.getMessage()))
                            .thenReturn(new IngestionResult(note.id(), note.metadata().type(), List.copyOf(matches)));
                });
    }
}
