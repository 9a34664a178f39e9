package com.notegraph.main.decay;

import com.notegraph.common.model.BacklinksIndex;
import com.notegraph.common.model.Cluster;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.DecayIndex;
import com.notegraph.common.model.DecayReason;
import com.notegraph.common.model.DecayRecord;
import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.main.config.GraphProperties;
import com.notegraph.main.exception.ClusterIntegrityException;
import com.notegraph.main.similarity.SimilarityEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores note staleness from link density and cluster cohesion.
 * <p>
 * Signals are additive and the total is capped at 1.0:
 * <ul>
 *     <li>no-links: no backlinks, +0.4</li>
 *     <li>low-link-density: fewer than two backlinks, +0.2 (stacks with no-links)</li>
 *     <li>cluster-outlier: clustered, but centroid similarity below the outlier threshold, +0.3</li>
 *     <li>no-cluster: in no cluster, +0.1</li>
 * </ul>
 * Only notes scoring at least the decay threshold are recorded.
 */
@Component
@RequiredArgsConstructor
public class DecayScorer {

    static final double WEIGHT_NO_LINKS = 0.4;
    static final double WEIGHT_LOW_LINK_DENSITY = 0.2;
    static final double WEIGHT_CLUSTER_OUTLIER = 0.3;
    static final double WEIGHT_NO_CLUSTER = 0.1;

    static final int MIN_LINK_COUNT = 2;

    private final SimilarityEngine similarityEngine;
    private final GraphProperties properties;
    private final Clock clock;

    public DecayIndex computeDecay(EmbeddingsIndex embeddings, BacklinksIndex backlinks, ClustersIndex clusters) {
        return computeDecay(embeddings, backlinks, clusters,
                properties.getClusterOutlierThreshold(), properties.getDecayScoreThreshold());
    }

    /**
     * @throws ClusterIntegrityException if a note is a member of more than one cluster
     */
    public DecayIndex computeDecay(EmbeddingsIndex embeddings,
                                   BacklinksIndex backlinks,
                                   ClustersIndex clusters,
                                   double outlierThreshold,
                                   double scoreThreshold) {
        Instant now = clock.instant();
        Map<String, Cluster> clusterByNote = clusterByNote(clusters);
        Map<String, DecayRecord> records = new LinkedHashMap<>();

        for (Map.Entry<String, EmbeddingRecord> entry : embeddings.embeddings().entrySet()) {
            String noteId = entry.getKey();
            List<DecayReason> reasons = new ArrayList<>();
            double score = 0;

            int linkCount = backlinks.linkCount(noteId);
            if (linkCount == 0) {
                reasons.add(DecayReason.NO_LINKS);
                score += WEIGHT_NO_LINKS;
            }
            if (linkCount < MIN_LINK_COUNT) {
                reasons.add(DecayReason.LOW_LINK_DENSITY);
                score += WEIGHT_LOW_LINK_DENSITY;
            }

            Cluster cluster = clusterByNote.get(noteId);
            if (cluster == null) {
                reasons.add(DecayReason.NO_CLUSTER);
                score += WEIGHT_NO_CLUSTER;
            } else if (similarityEngine.cosineSimilarity(entry.getValue().vector(), cluster.centroid()) < outlierThreshold) {
                reasons.add(DecayReason.CLUSTER_OUTLIER);
                score += WEIGHT_CLUSTER_OUTLIER;
            }

            score = Math.min(score, 1.0);
            if (score >= scoreThreshold) {
                records.put(noteId, new DecayRecord(noteId, score, reasons, now));
            }
        }

        return new DecayIndex(records, now);
    }

    private Map<String, Cluster> clusterByNote(ClustersIndex clusters) {
        Map<String, Cluster> byNote = new HashMap<>();
        for (Cluster cluster : clusters.clusters().values()) {
            for (String noteId : cluster.noteIds()) {
                Cluster previous = byNote.putIfAbsent(noteId, cluster);
                if (previous != null && !previous.id().equals(cluster.id())) {
                    throw new ClusterIntegrityException(noteId, previous.id(), cluster.id());
                }
            }
        }
        return byNote;
    }
}
