package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Embedding of a single note. Created once at ingestion and never mutated.
 */
public record EmbeddingRecord(
    @NotBlank
    @JsonProperty("noteId")
    String noteId,

    @NotNull
    @Size(min = 1)
    @JsonProperty("vector")
    double[] vector,

    @JsonProperty("model")
    String model,

    @JsonProperty("createdAt")
    Instant createdAt
) {
    @JsonCreator
    public EmbeddingRecord {
        if (noteId == null || noteId.isBlank()) {
            throw new IllegalArgumentException("noteId cannot be null or blank");
        }
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("vector cannot be null or empty");
        }
    }
}
