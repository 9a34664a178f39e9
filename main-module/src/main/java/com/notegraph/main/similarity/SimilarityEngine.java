package com.notegraph.main.similarity;

import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.main.exception.DegenerateVectorException;
import com.notegraph.main.exception.DimensionMismatchException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cosine similarity and threshold nearest-neighbour scan over the embeddings index.
 */
@Component
public class SimilarityEngine {

    /**
     * @return {@code dot(a, b) / (|a| |b|)}, in [-1, 1]
     * @throws DimensionMismatchException if lengths differ
     * @throws DegenerateVectorException  if either vector is empty or has zero magnitude
     */
    public double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        if (a.length == 0) {
            throw new DegenerateVectorException("Cannot compute similarity of empty vectors");
        }

        double dot = 0;
        double magnitudeA = 0;
        double magnitudeB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            magnitudeA += a[i] * a[i];
            magnitudeB += b[i] * b[i];
        }

        double magnitude = Math.sqrt(magnitudeA) * Math.sqrt(magnitudeB);
        if (magnitude == 0) {
            throw new DegenerateVectorException("Cannot compute similarity: zero magnitude vector");
        }
        // rounding can push identical vectors just past 1
        return Math.max(-1.0, Math.min(1.0, dot / magnitude));
    }

    /**
     * Linear scan keeping every embedding at or above the threshold, most similar first.
     */
    public List<SimilarityMatch> findMatches(double[] target, EmbeddingsIndex index, double threshold, Set<String> excludeIds) {
        List<SimilarityMatch> matches = new ArrayList<>();
        for (Map.Entry<String, EmbeddingRecord> entry : index.embeddings().entrySet()) {
            if (excludeIds.contains(entry.getKey())) {
                continue;
            }
            double similarity = cosineSimilarity(target, entry.getValue().vector());
            if (similarity >= threshold) {
                matches.add(new SimilarityMatch(entry.getKey(), similarity));
            }
        }
        matches.sort(Comparator.comparingDouble(SimilarityMatch::similarity).reversed());
        return matches;
    }
}
