package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

import java.time.Instant;
import java.util.List;

public record DecayRecord(
    @JsonProperty("noteId")
    String noteId,

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @JsonProperty("score")
    double score,

    @JsonProperty("reasons")
    List<DecayReason> reasons,

    @JsonProperty("computedAt")
    Instant computedAt
) {
    @JsonCreator
    public DecayRecord {
        if (noteId == null || reasons == null) {
            throw new IllegalArgumentException("decay record requires noteId and reasons");
        }
        IndexChecks.requireElements(reasons, "reasons of " + noteId);
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Decay score must be between 0 and 1, got " + score);
        }
    }
}
