package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * clusterId -> cluster. Replaced wholesale on every clustering pass.
 */
public record ClustersIndex(
    @JsonProperty("clusters")
    Map<String, Cluster> clusters,

    @JsonProperty("computedAt")
    Instant computedAt
) {
    @JsonCreator
    public ClustersIndex {
        if (clusters == null) {
            throw new IllegalArgumentException("clusters map is required");
        }
        IndexChecks.requireEntries(clusters, "clusters");
    }

    public static ClustersIndex empty() {
        return new ClustersIndex(new LinkedHashMap<>(), Instant.now());
    }

    public boolean isEmpty() {
        return clusters.isEmpty();
    }
}
