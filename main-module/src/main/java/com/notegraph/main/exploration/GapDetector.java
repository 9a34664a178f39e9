package com.notegraph.main.exploration;

import com.notegraph.common.model.BacklinksIndex;
import com.notegraph.common.model.Cluster;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.common.model.ExplorationSuggestion;
import com.notegraph.common.model.ExplorationsIndex;
import com.notegraph.common.model.NoteIds;
import com.notegraph.common.model.RelationsIndex;
import com.notegraph.common.model.TypedRelation;
import com.notegraph.main.config.GraphProperties;
import com.notegraph.main.similarity.SimilarityEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects structural gaps in the graph. All checks run in one pass and share {@code computedAt} and the id counter.
 */
@Component
@RequiredArgsConstructor
public class GapDetector {

    static final String EXPLORATION_ID_PREFIX = "exploration-";

    private final SimilarityEngine similarityEngine;
    private final GraphProperties properties;
    private final Clock clock;

    public ExplorationsIndex detectGaps(EmbeddingsIndex embeddings,
                                        BacklinksIndex backlinks,
                                        ClustersIndex clusters,
                                        RelationsIndex relations,
                                        Set<String> metaNoteIds) {
        return detectGaps(embeddings, backlinks, clusters, relations, metaNoteIds, properties.getCloseClusterThreshold());
    }

    /**
     * @param metaNoteIds ids of meta notes, or null to skip the meta-note-missing check entirely
     */
    public ExplorationsIndex detectGaps(EmbeddingsIndex embeddings,
                                        BacklinksIndex backlinks,
                                        ClustersIndex clusters,
                                        RelationsIndex relations,
                                        Set<String> metaNoteIds,
                                        double closeClusterThreshold) {
        Instant now = clock.instant();
        List<ExplorationSuggestion> suggestions = new ArrayList<>();
        IdSequence ids = new IdSequence();

        for (String noteId : embeddings.embeddings().keySet()) {
            if (backlinks.linkCount(noteId) == 0) {
                suggestions.add(new ExplorationSuggestion.OrphanNote(ids.next(), noteId, now));
            }
        }

        List<Cluster> clusterList = new ArrayList<>(clusters.clusters().values());
        for (int i = 0; i < clusterList.size(); i++) {
            for (int j = i + 1; j < clusterList.size(); j++) {
                Cluster a = clusterList.get(i);
                Cluster b = clusterList.get(j);
                double similarity = similarityEngine.cosineSimilarity(a.centroid(), b.centroid());
                if (similarity > closeClusterThreshold) {
                    suggestions.add(new ExplorationSuggestion.CloseClusters(ids.next(),
                            NoteIds.first(a.id(), b.id()), NoteIds.second(a.id(), b.id()), similarity, now));
                }
            }
        }

        Collection<TypedRelation> relationList = relations.relations().values();
        for (Cluster cluster : clusterList) {
            if (!hasBoundaryRelation(cluster, relationList)) {
                suggestions.add(new ExplorationSuggestion.StructuralHole(ids.next(), cluster.id(), now));
            }
        }

        if (metaNoteIds != null) {
            for (Cluster cluster : clusterList) {
                boolean hasMeta = cluster.noteIds().stream().anyMatch(metaNoteIds::contains);
                if (!hasMeta) {
                    suggestions.add(new ExplorationSuggestion.MetaNoteMissing(ids.next(), cluster.id(), now));
                }
            }
        }

        return new ExplorationsIndex(suggestions, now);
    }

    // exactly one endpoint inside; relations internal to the cluster do not count
    private boolean hasBoundaryRelation(Cluster cluster, Collection<TypedRelation> relations) {
        Set<String> members = new HashSet<>(cluster.noteIds());
        return relations.stream()
                .anyMatch(relation -> members.contains(relation.noteA()) != members.contains(relation.noteB()));
    }

    private static final class IdSequence {
        private int counter;

        String next() {
            return EXPLORATION_ID_PREFIX + (++counter);
        }
    }
}
