package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * One directed side of a symmetric similarity link.
 */
public record BacklinkEntry(
    @NotBlank
    @JsonProperty("targetId")
    String targetId,

    @JsonProperty("similarity")
    double similarity
) {
    @JsonCreator
    public BacklinkEntry {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("targetId cannot be null or blank");
        }
    }
}
