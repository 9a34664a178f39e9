package com.notegraph.main.snapshot;

import com.notegraph.common.model.BacklinkEntry;
import com.notegraph.common.model.BacklinksIndex;
import com.notegraph.common.model.Cluster;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.DecayIndex;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.common.model.GraphSnapshot;
import com.notegraph.common.model.TensionsIndex;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SnapshotCalculator {

    static final String SNAPSHOT_ID_PREFIX = "snapshot-";

    private final Clock clock;

    public GraphSnapshot capture(EmbeddingsIndex embeddings,
                                 BacklinksIndex backlinks,
                                 ClustersIndex clusters,
                                 TensionsIndex tensions,
                                 DecayIndex decay) {
        Instant now = clock.instant();
        int noteCount = embeddings.size();

        int undirectedLinks = 0;
        int directedLinks = 0;
        for (Map.Entry<String, List<BacklinkEntry>> entry : backlinks.links().entrySet()) {
            for (BacklinkEntry link : entry.getValue()) {
                directedLinks++;
                if (entry.getKey().compareTo(link.targetId()) < 0) {
                    undirectedLinks++;
                }
            }
        }

        Map<String, Integer> clusterSizes = new LinkedHashMap<>();
        for (Cluster cluster : clusters.clusters().values()) {
            clusterSizes.put(cluster.id(), cluster.size());
        }

        double avgLinksPerNote = noteCount == 0 ? 0 : (double) directedLinks / noteCount;

        return new GraphSnapshot(SNAPSHOT_ID_PREFIX + now.toEpochMilli(), now, noteCount, undirectedLinks,
                clusters.clusters().size(), tensions.tensions().size(), decay.records().size(),
                clusterSizes, avgLinksPerNote);
    }
}
