package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate graph counts at one point in time. Immutable once appended.
 */
public record GraphSnapshot(
    @JsonProperty("id")
    String id,

    @JsonProperty("capturedAt")
    Instant capturedAt,

    @JsonProperty("noteCount")
    int noteCount,

    /* unique undirected pairs */
    @JsonProperty("linkCount")
    int linkCount,

    @JsonProperty("clusterCount")
    int clusterCount,

    @JsonProperty("tensionCount")
    int tensionCount,

    @JsonProperty("decayCount")
    int decayCount,

    @JsonProperty("clusterSizes")
    Map<String, Integer> clusterSizes,

    @JsonProperty("avgLinksPerNote")
    double avgLinksPerNote
) {
    @JsonCreator
    public GraphSnapshot {
        if (id == null || capturedAt == null) {
            throw new IllegalArgumentException("snapshot requires id and capturedAt");
        }
        if (clusterSizes == null) {
            clusterSizes = Map.of();
        }
    }
}
