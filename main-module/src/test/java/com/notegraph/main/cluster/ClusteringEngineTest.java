package com.notegraph.main.cluster;

import com.notegraph.common.model.Cluster;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.main.config.GraphProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit-тесты для ClusteringEngine
 */
class ClusteringEngineTest {

    private static final Instant NOW = Instant.parse("2026-02-22T15:30:45Z");

    private final GraphProperties properties = new GraphProperties();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    @DisplayName("chooseK: clamp(floor(sqrt(n/2)), min, max), 0 при n < min")
    void chooseK() {
        assertThat(ClusteringEngine.chooseK(1, 2, 20)).isZero();
        assertThat(ClusteringEngine.chooseK(3, 2, 20)).isEqualTo(2);
        assertThat(ClusteringEngine.chooseK(50, 2, 20)).isEqualTo(5);
        assertThat(ClusteringEngine.chooseK(200, 2, 20)).isEqualTo(10);
        assertThat(ClusteringEngine.chooseK(1000, 2, 20)).isEqualTo(20);
    }

    @Test
    @DisplayName("Меньше минимума нот: кластеров нет")
    void tooFewNotes() {
        ClusteringEngine engine = new ClusteringEngine(properties, clock, new Random(1));
        EmbeddingsIndex index = EmbeddingsIndex.empty()
                .upsert(record("a", 1, 0))
                .upsert(record("b", 0, 1));

        ClustersIndex clusters = engine.clusterEmbeddings(index);

        assertThat(clusters.clusters()).isEmpty();
        assertThat(clusters.computedAt()).isEqualTo(NOW);
    }

    @ParameterizedTest
    @ValueSource(longs = {0, 1, 7, 42, 1234})
    @DisplayName("Две явные группы разделяются при k=2 при любом seed")
    void separatesTwoGroups(long seed) {
        ClusteringEngine engine = new ClusteringEngine(properties, clock, new Random(seed));
        EmbeddingsIndex index = EmbeddingsIndex.empty()
                .upsert(record("a1", 1, 0))
                .upsert(record("b1", 0, 1))
                .upsert(record("a2", 1, 0))
                .upsert(record("b2", 0, 1))
                .upsert(record("a3", 1, 0))
                .upsert(record("b3", 0, 1));

        ClustersIndex clusters = engine.clusterEmbeddings(index, 2, null);

        assertThat(clusters.clusters()).hasSize(2);
        assertThat(clusters.clusters().values())
                .extracting(Cluster::noteIds)
                .containsExactlyInAnyOrder(List.of("a1", "a2", "a3"), List.of("b1", "b2", "b3"));
        for (Cluster cluster : clusters.clusters().values()) {
            assertThat(cluster.id()).startsWith("cluster-");
            assertThat(cluster.createdAt()).isEqualTo(NOW);
        }
    }

    @Test
    @DisplayName("Каждая нота попадает ровно в один кластер, участники отсортированы")
    void everyNoteInExactlyOneCluster() {
        ClusteringEngine engine = new ClusteringEngine(properties, clock, new Random(3));
        Random data = new Random(99);
        EmbeddingsIndex index = EmbeddingsIndex.empty();
        for (int i = 0; i < 40; i++) {
            index.upsert(record(String.format("note-%02d", i), data.nextGaussian(), data.nextGaussian(), data.nextGaussian()));
        }

        ClustersIndex clusters = engine.clusterEmbeddings(index);

        List<String> members = new ArrayList<>();
        for (Cluster cluster : clusters.clusters().values()) {
            assertThat(cluster.noteIds()).isNotEmpty().isSorted();
            members.addAll(cluster.noteIds());
        }
        assertThat(members).doesNotHaveDuplicates().hasSize(40);
        assertThat(clusters.clusters().size()).isBetween(1, ClusteringEngine.chooseK(40, 2, 20));
    }

    @Test
    @DisplayName("kmeans останавливается, когда назначения не меняются")
    void kmeansConverges() {
        ClusteringEngine engine = new ClusteringEngine(properties, clock, new Random(5));
        double[][] vectors = {{0, 0}, {0, 1}, {10, 10}, {10, 11}};
        double[][] initial = {{0, 0}, {10, 10}};

        KMeansResult result = engine.kmeans(vectors, 2, 50, initial);

        assertThat(result.assignments()).containsExactly(0, 0, 1, 1);
        assertThat(result.centroids()[0]).containsExactly(0.0, 0.5);
        assertThat(result.centroids()[1]).containsExactly(10.0, 10.5);
        assertThat(result.iterations()).isLessThan(50);
    }

    @Test
    @DisplayName("Пустой кластер сохраняет прежний центроид")
    void emptyClusterKeepsCentroid() {
        ClusteringEngine engine = new ClusteringEngine(properties, clock, new Random(5));
        double[][] vectors = {{0, 0}, {0, 1}, {5, 5}};
        double[][] initial = {{0, 0}, {100, 100}, {5, 5}};

        KMeansResult result = engine.kmeans(vectors, 3, 10, initial);

        assertThat(result.assignments()).containsExactly(0, 0, 2);
        assertThat(result.centroids()[0]).containsExactly(0.0, 0.5);
        assertThat(result.centroids()[1]).containsExactly(100.0, 100.0);
    }

    private static EmbeddingRecord record(String id, double... vector) {
        return new EmbeddingRecord(id, vector, "test-model", NOW);
    }
}
