package com.notegraph.main.tension;

import com.notegraph.common.model.Cluster;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.common.model.NoteIds;
import com.notegraph.common.model.Tension;
import com.notegraph.common.model.TensionsIndex;
import com.notegraph.main.config.GraphProperties;
import com.notegraph.main.similarity.SimilarityEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds pairs of notes that share a cluster but are semantically far apart.
 */
@Component
@RequiredArgsConstructor
public class TensionDetector {

    static final String TENSION_ID_PREFIX = "tension-";

    private final SimilarityEngine similarityEngine;
    private final GraphProperties properties;
    private final Clock clock;

    public TensionsIndex detectTensions(EmbeddingsIndex embeddings, ClustersIndex clusters) {
        return detectTensions(embeddings, clusters, properties.getTensionThreshold());
    }

    /**
     * Every unordered member pair of every cluster with at least two members is compared;
     * pairs below the threshold become tensions. Pairs missing an embedding are skipped.
     */
    public TensionsIndex detectTensions(EmbeddingsIndex embeddings, ClustersIndex clusters, double threshold) {
        Instant now = clock.instant();
        Map<String, Tension> tensions = new LinkedHashMap<>();
        int counter = 0;

        for (Cluster cluster : clusters.clusters().values()) {
            List<String> noteIds = cluster.noteIds();
            if (noteIds.size() < 2) {
                continue;
            }
            for (int i = 0; i < noteIds.size(); i++) {
                for (int j = i + 1; j < noteIds.size(); j++) {
                    EmbeddingRecord a = embeddings.embeddings().get(noteIds.get(i));
                    EmbeddingRecord b = embeddings.embeddings().get(noteIds.get(j));
                    if (a == null || b == null) {
                        continue;
                    }
                    double similarity = similarityEngine.cosineSimilarity(a.vector(), b.vector());
                    if (similarity < threshold) {
                        String id = TENSION_ID_PREFIX + counter++;
                        tensions.put(id, new Tension(id,
                                NoteIds.first(noteIds.get(i), noteIds.get(j)),
                                NoteIds.second(noteIds.get(i), noteIds.get(j)),
                                similarity, cluster.id(), now));
                    }
                }
            }
        }

        return new TensionsIndex(tensions, now);
    }
}
