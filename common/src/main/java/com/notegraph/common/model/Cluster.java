package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * A semantic cluster of notes with its centroid and sorted member ids.
 */
public record Cluster(
    @NotBlank
    @JsonProperty("id")
    String id,

    @NotNull
    @JsonProperty("centroid")
    double[] centroid,

    @NotNull
    @JsonProperty("noteIds")
    List<String> noteIds,

    @JsonProperty("createdAt")
    Instant createdAt,

    @JsonProperty("updatedAt")
    Instant updatedAt
) {
    @JsonCreator
    public Cluster {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("cluster id cannot be null or blank");
        }
        if (centroid == null) {
            throw new IllegalArgumentException("centroid is required for cluster " + id);
        }
        if (noteIds == null) {
            throw new IllegalArgumentException("noteIds are required for cluster " + id);
        }
        IndexChecks.requireElements(noteIds, "noteIds of cluster " + id);
    }

    public int size() {
        return noteIds.size();
    }
}
