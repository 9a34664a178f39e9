package com.notegraph.main.similarity;

import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.main.exception.DegenerateVectorException;
import com.notegraph.main.exception.DimensionMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SimilarityEngineTest {

    private final SimilarityEngine engine = new SimilarityEngine();

    @Test
    @DisplayName("Косинус вектора с самим собой равен 1")
    void selfSimilarityIsOne() {
        double[] v = {0.3, -1.2, 4.5, 0.01};
        assertThat(engine.cosineSimilarity(v, v)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Косинус симметричен и лежит в [-1, 1]")
    void symmetricAndBounded() {
        double[] a = {1.0, 2.0, 3.0};
        double[] b = {-2.0, 0.5, 1.0};

        double ab = engine.cosineSimilarity(a, b);
        assertThat(ab).isEqualTo(engine.cosineSimilarity(b, a));
        assertThat(ab).isBetween(-1.0, 1.0);
        assertThat(engine.cosineSimilarity(new double[]{1, 0}, new double[]{-1, 0})).isEqualTo(-1.0);
        assertThat(engine.cosineSimilarity(new double[]{1, 0}, new double[]{0, 1})).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Разная размерность и нулевой вектор отклоняются")
    void rejectsInvalidVectors() {
        assertThatThrownBy(() -> engine.cosineSimilarity(new double[]{1, 0}, new double[]{1, 0, 0}))
                .isInstanceOf(DimensionMismatchException.class);
        assertThatThrownBy(() -> engine.cosineSimilarity(new double[]{0, 0}, new double[]{1, 0}))
                .isInstanceOf(DegenerateVectorException.class);
        assertThatThrownBy(() -> engine.cosineSimilarity(new double[0], new double[0]))
                .isInstanceOf(DegenerateVectorException.class);
    }

    @Test
    @DisplayName("findMatches фильтрует по порогу, исключает id и сортирует по убыванию")
    void findMatchesFiltersAndSorts() {
        EmbeddingsIndex index = EmbeddingsIndex.empty()
                .upsert(record("a", 1.0, 0.0))
                .upsert(record("b", 0.9, 0.1))
                .upsert(record("c", 0.0, 1.0))
                .upsert(record("d", 1.0, 0.05));

        List<SimilarityMatch> matches = engine.findMatches(new double[]{1.0, 0.0}, index, 0.8, Set.of("a"));

        assertThat(matches).extracting(SimilarityMatch::noteId).containsExactly("d", "b");
        assertThat(matches.get(0).similarity()).isGreaterThan(matches.get(1).similarity());
    }

    private static EmbeddingRecord record(String id, double... vector) {
        return new EmbeddingRecord(id, vector, "test-model", Instant.EPOCH);
    }
}
