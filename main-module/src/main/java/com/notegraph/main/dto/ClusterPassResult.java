package com.notegraph.main.dto;

import com.notegraph.common.model.Cluster;

import java.util.List;

public record ClusterPassResult(int noteCount, int clusterCount, List<ClusterSummary> clusters) {

    public record ClusterSummary(String id, int size, List<String> noteIds) {

        public static ClusterSummary of(Cluster cluster) {
            return new ClusterSummary(cluster.id(), cluster.size(), cluster.noteIds());
        }
    }
}
