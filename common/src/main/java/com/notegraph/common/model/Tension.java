package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Two notes sharing a cluster whose embeddings diverge. {@code noteA < noteB}.
 */
public record Tension(
    @JsonProperty("id")
    String id,

    @JsonProperty("noteA")
    String noteA,

    @JsonProperty("noteB")
    String noteB,

    @JsonProperty("similarity")
    double similarity,

    @JsonProperty("clusterId")
    String clusterId,

    @JsonProperty("detectedAt")
    Instant detectedAt
) {
    @JsonCreator
    public Tension {
        if (id == null || noteA == null || noteB == null || clusterId == null) {
            throw new IllegalArgumentException("tension requires id, noteA, noteB and clusterId");
        }
        if (noteA.compareTo(noteB) >= 0) {
            throw new IllegalArgumentException("tension notes must be in canonical order: " + noteA + ", " + noteB);
        }
    }
}
