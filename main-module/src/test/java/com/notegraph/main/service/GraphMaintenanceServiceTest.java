package com.notegraph.main.service;

import com.notegraph.common.exception.ValidationException;
import com.notegraph.common.model.BacklinkEntry;
import com.notegraph.common.model.Cluster;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.ExplorationSuggestion;
import com.notegraph.common.model.Note;
import com.notegraph.common.model.NoteMetadata;
import com.notegraph.common.model.NoteType;
import com.notegraph.common.model.RefinementSuggestion;
import com.notegraph.common.model.RefinementType;
import com.notegraph.common.model.RelationType;
import com.notegraph.common.model.TypedRelation;
import com.notegraph.main.InMemoryGraphFixture;
import com.notegraph.main.cluster.ClusteringEngine;
import com.notegraph.main.config.GraphProperties;
import com.notegraph.main.decay.DecayScorer;
import com.notegraph.main.exploration.GapDetector;
import com.notegraph.main.graph.GraphMaintainer;
import com.notegraph.main.refinement.RefinementSubmission;
import com.notegraph.main.relation.RelationRegistry;
import com.notegraph.main.relation.RelationSubmission;
import com.notegraph.main.similarity.SimilarityEngine;
import com.notegraph.main.snapshot.SnapshotCalculator;
import com.notegraph.main.snapshot.SnapshotTimeline;
import com.notegraph.main.tension.TensionDetector;
import com.notegraph.storage.index.IndexDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Тесты проходов обслуживания графа на in-memory хранилище
 */
class GraphMaintenanceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private static final String A = "20260301T100000-0000000a";
    private static final String B = "20260301T100001-0000000b";
    private static final String C = "20260301T100002-0000000c";
    private static final String D = "20260301T100003-0000000d";
    private static final String E = "20260301T100004-0000000e";
    private static final String F = "20260301T100005-0000000f";

    private final GraphMaintainer graphMaintainer = new GraphMaintainer();

    private InMemoryGraphFixture fixture;
    private GraphMaintenanceService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        GraphProperties properties = new GraphProperties();
        SimilarityEngine similarityEngine = new SimilarityEngine();
        fixture = new InMemoryGraphFixture(clock);
        service = new GraphMaintenanceService(
                fixture.indexRepository,
                similarityEngine,
                new ClusteringEngine(properties, clock, new Random(11)),
                graphMaintainer,
                new DecayScorer(similarityEngine, properties, clock),
                new TensionDetector(similarityEngine, properties, clock),
                new GapDetector(similarityEngine, properties, clock),
                new RelationRegistry(),
                new SnapshotCalculator(clock),
                new SnapshotTimeline(),
                new NoteContentFetcher(fixture.noteRepository, properties),
                properties,
                clock);
    }

    @Test
    @DisplayName("linkPass пересобирает backlinks из эмбеддингов и убирает устаревшие связи")
    void linkPassRebuildsBacklinks() {
        embed(A, 1.0, 0.0);
        embed(B, 0.99, 0.1);
        embed(C, 0.0, 1.0);
        fixture.indexRepository.update(IndexDocument.BACKLINKS, index -> {
            graphMaintainer.addLink(index, A, C, 0.9);
            return index;
        }).block();

        StepVerifier.create(service.linkPass())
                .assertNext(result -> {
                    assertThat(result.notesProcessed()).isEqualTo(3);
                    assertThat(result.totalLinks()).isEqualTo(1);
                })
                .verifyComplete();

        var backlinks = fixture.indexRepository.readBacklinks().block();
        assertThat(backlinks.links()).containsOnlyKeys(A, B);
        assertThat(backlinks.linksOf(A)).extracting(BacklinkEntry::targetId).containsExactly(B);
    }

    @Test
    @DisplayName("clusterPass отклоняет k < 2 до обращения к хранилищу")
    void clusterPassValidatesK() {
        StepVerifier.create(service.clusterPass(1))
                .expectError(ValidationException.class)
                .verify();

        verify(fixture.store, never()).get(any());
    }

    @Test
    @DisplayName("clusterPass при малом числе нот ничего не пишет")
    void clusterPassSkipsSmallGraph() {
        embed(A, 1.0, 0.0);
        embed(B, 0.0, 1.0);
        clearInvocations(fixture.store);

        StepVerifier.create(service.clusterPass(null))
                .assertNext(result -> {
                    assertThat(result.noteCount()).isEqualTo(2);
                    assertThat(result.clusterCount()).isZero();
                })
                .verifyComplete();

        verify(fixture.store, never()).put(any(), any(), any());
    }

    @Test
    @DisplayName("clusterPass с k=2 разделяет две группы и сохраняет индекс")
    void clusterPassWritesClusters() {
        embedTwoGroups();

        StepVerifier.create(service.clusterPass(2))
                .assertNext(result -> {
                    assertThat(result.noteCount()).isEqualTo(6);
                    assertThat(result.clusterCount()).isEqualTo(2);
                    assertThat(result.clusters()).allSatisfy(summary -> assertThat(summary.size()).isEqualTo(3));
                })
                .verifyComplete();

        assertThat(fixture.indexRepository.readClusters().block().clusters()).hasSize(2);
    }

    @Test
    @DisplayName("tensionPass без кластеров требует сначала кластеризацию")
    void tensionPassRequiresClusters() {
        embedTwoGroups();

        StepVerifier.create(service.tensionPass())
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ValidationException.class)
                        .hasMessageContaining("cluster pass"))
                .verify();
    }

    @Test
    @DisplayName("tensionPass при малом числе нот возвращает ноль напряжений")
    void tensionPassSkipsSmallGraph() {
        embed(A, 1.0, 0.0);

        StepVerifier.create(service.tensionPass())
                .assertNext(result -> assertThat(result.tensionCount()).isZero())
                .verifyComplete();
    }

    @Test
    @DisplayName("tensionPass находит расходящиеся ноты одного кластера")
    void tensionPassPersistsTensions() {
        embedTwoGroups();
        replaceClusters(cluster("cluster-0", new double[]{0.5, 0.5}, A, B, C, D, E, F));

        StepVerifier.create(service.tensionPass())
                .assertNext(result -> {
                    assertThat(result.clusterCount()).isEqualTo(1);
                    // three a-vectors against three b-vectors
                    assertThat(result.tensionCount()).isEqualTo(9);
                })
                .verifyComplete();

        assertThat(fixture.indexRepository.readTensions().block().tensions()).hasSize(9);
    }

    @Test
    @DisplayName("decayPass сохраняет только ноты выше порога")
    void decayPassPersistsStaleNotes() {
        embed(A, 1.0, 0.0);
        embed(B, 1.0, 0.0);

        StepVerifier.create(service.decayPass())
                .assertNext(result -> {
                    assertThat(result.noteCount()).isEqualTo(2);
                    assertThat(result.staleCount()).isEqualTo(2);
                })
                .verifyComplete();

        assertThat(fixture.indexRepository.readDecay().block().records()).containsOnlyKeys(A, B);
    }

    @Test
    @DisplayName("explorationPass определяет meta-ноты по документам и считает типы")
    void explorationPassCountsByType() {
        embed(A, 1.0, 0.0);
        embed(B, 1.0, 0.0);
        embed(C, 0.0, 1.0);
        embed(D, 0.0, 1.0);
        replaceClusters(
                cluster("cluster-0", new double[]{1, 0}, A, B),
                cluster("cluster-1", new double[]{0, 1}, C, D));
        createNote(A, NoteType.META);
        createNote(C, NoteType.HYPOTHESIS);

        StepVerifier.create(service.explorationPass())
                .assertNext(result -> {
                    assertThat(result.byType()).containsEntry(ExplorationSuggestion.ORPHAN_NOTE, 4)
                            .containsEntry(ExplorationSuggestion.STRUCTURAL_HOLE, 2)
                            .containsEntry(ExplorationSuggestion.META_NOTE_MISSING, 1)
                            .doesNotContainKey(ExplorationSuggestion.CLOSE_CLUSTERS);
                    assertThat(result.suggestionCount()).isEqualTo(7);
                })
                .verifyComplete();

        assertThat(fixture.indexRepository.readExplorations().block().suggestions()).hasSize(7);
    }

    @Test
    @DisplayName("submitRelations копирует similarity из backlinks и хранит канонический порядок")
    void submitRelationsStoresRelation() {
        linkAB(0.91);

        StepVerifier.create(service.submitRelations(List.of(new RelationSubmission(B, A, "supports", "same claim"))))
                .assertNext(result -> {
                    assertThat(result.updated()).isEqualTo(1);
                    assertThat(result.total()).isEqualTo(1);
                })
                .verifyComplete();

        TypedRelation relation = fixture.indexRepository.readRelations().block().relations().values().iterator().next();
        assertThat(relation.noteA()).isEqualTo(A);
        assertThat(relation.noteB()).isEqualTo(B);
        assertThat(relation.relationType()).isEqualTo(RelationType.SUPPORTS);
        assertThat(relation.similarity()).isEqualTo(0.91);
        assertThat(relation.classifiedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("submitRelations валидирует пакет целиком до обращения к хранилищу")
    void submitRelationsValidatesFirst() {
        List<RelationSubmission> submissions = List.of(
                new RelationSubmission(A, B, "supports", "ok"),
                new RelationSubmission(A, C, "agrees-with", "bad type"));

        StepVerifier.create(service.submitRelations(submissions))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ValidationException.class)
                        .hasMessageContaining("relations[1]"))
                .verify();

        verify(fixture.store, never()).get(any());
    }

    @Test
    @DisplayName("submitRelations отклоняет пару без связи")
    void submitRelationsRequiresLink() {
        linkAB(0.91);

        StepVerifier.create(service.submitRelations(List.of(new RelationSubmission(A, C, "refines", "narrower"))))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ValidationException.class)
                        .hasMessageContaining("not found in backlinks"))
                .verify();

        assertThat(fixture.store.paths()).doesNotContain("index/relations.json");
    }

    @Test
    @DisplayName("submitRefinements хранит по одной подсказке на пару нота/тип")
    void submitRefinementsUpsertsByNoteAndType() {
        service.submitRefinements(List.of(
                new RefinementSubmission(A, "retitle", "Call it Alpha", "title is vague", null))).block();

        StepVerifier.create(service.submitRefinements(List.of(
                        new RefinementSubmission(A, "retitle", "Call it Alpha prime", "still vague", List.of(B)),
                        new RefinementSubmission(A, "split", "Split the second half", "two ideas", List.of()))))
                .assertNext(result -> {
                    assertThat(result.updated()).isEqualTo(2);
                    assertThat(result.total()).isEqualTo(2);
                })
                .verifyComplete();

        Map<String, RefinementSuggestion> stored = fixture.indexRepository.readRefinements().block().suggestions();
        assertThat(stored).containsOnlyKeys(A + ":retitle", A + ":split");
        RefinementSuggestion retitle = stored.get(A + ":retitle");
        assertThat(retitle.type()).isEqualTo(RefinementType.RETITLE);
        assertThat(retitle.suggestion()).isEqualTo("Call it Alpha prime");
        assertThat(retitle.relatedNoteIds()).containsExactly(B);
        assertThat(retitle.generatedAt()).isEqualTo(NOW);
        assertThat(fixture.store.paths()).doesNotContain(fixture.noteRepository.pathOf(A));
    }

    @Test
    @DisplayName("submitRefinements валидирует пакет целиком до обращения к хранилищу")
    void submitRefinementsValidatesFirst() {
        List<RefinementSubmission> submissions = List.of(
                new RefinementSubmission(A, "update", "Mention the new result", "outdated", null),
                new RefinementSubmission(B, "rewrite", "Rewrite everything", "bad type", null));

        StepVerifier.create(service.submitRefinements(submissions))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ValidationException.class)
                        .hasMessageContaining("suggestions[1]")
                        .hasMessageContaining("rewrite"))
                .verify();
        StepVerifier.create(service.submitRefinements(List.of(
                        new RefinementSubmission(A, "merge-suggest", " ", "overlaps", List.of(B)))))
                .expectErrorSatisfies(error -> assertThat(error).hasMessageContaining("suggestions[0].suggestion"))
                .verify();
        StepVerifier.create(service.submitRefinements(List.of()))
                .expectError(ValidationException.class)
                .verify();

        verify(fixture.store, never()).get(any());
        verify(fixture.store, never()).put(any(), any(), any());
    }

    @Test
    @DisplayName("Снимок добавляется в серию и виден в аналитике")
    void snapshotAndAnalytics() {
        embed(A, 1.0, 0.0);
        embed(B, 1.0, 0.0);
        linkAB(1.0);

        StepVerifier.create(service.captureSnapshot())
                .assertNext(snapshot -> {
                    assertThat(snapshot.noteCount()).isEqualTo(2);
                    assertThat(snapshot.linkCount()).isEqualTo(1);
                })
                .verifyComplete();

        StepVerifier.create(service.analytics(null))
                .assertNext(result -> {
                    assertThat(result.snapshotCount()).isEqualTo(1);
                    assertThat(result.snapshots().get(0).delta()).isNull();
                })
                .verifyComplete();
        StepVerifier.create(service.analytics(NOW.plusSeconds(1)))
                .assertNext(result -> assertThat(result.snapshots()).isEmpty())
                .verifyComplete();
    }

    private void embed(String noteId, double... vector) {
        fixture.indexRepository.upsertEmbedding(new EmbeddingRecord(noteId, vector, "test-model", NOW)).block();
    }

    private void embedTwoGroups() {
        embed(A, 1.0, 0.0);
        embed(B, 0.0, 1.0);
        embed(C, 1.0, 0.0);
        embed(D, 0.0, 1.0);
        embed(E, 1.0, 0.0);
        embed(F, 0.0, 1.0);
    }

    private void linkAB(double similarity) {
        fixture.indexRepository.update(IndexDocument.BACKLINKS, index -> {
            graphMaintainer.addLink(index, A, B, similarity);
            return index;
        }).block();
        clearInvocations(fixture.store);
    }

    private void createNote(String noteId, NoteType type) {
        fixture.noteRepository.create(new Note(noteId, "Body of " + noteId, NoteMetadata.ofType(type),
                NOW, NOW, List.of())).block();
    }

    private void replaceClusters(Cluster... clusters) {
        Map<String, Cluster> map = new LinkedHashMap<>();
        for (Cluster cluster : clusters) {
            map.put(cluster.id(), cluster);
        }
        fixture.indexRepository.replace(IndexDocument.CLUSTERS, new ClustersIndex(map, NOW)).block();
    }

    private static Cluster cluster(String id, double[] centroid, String... noteIds) {
        return new Cluster(id, centroid, List.of(noteIds), NOW, NOW);
    }
}
