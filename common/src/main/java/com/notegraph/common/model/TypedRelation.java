package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A classified edge between two notes, stored under its canonical pair key.
 */
public record TypedRelation(
    @JsonProperty("noteA")
    String noteA,

    @JsonProperty("noteB")
    String noteB,

    @JsonProperty("relationType")
    RelationType relationType,

    @JsonProperty("reason")
    String reason,

    @JsonProperty("similarity")
    double similarity,

    @JsonProperty("classifiedAt")
    Instant classifiedAt
) {
    @JsonCreator
    public TypedRelation {
        if (noteA == null || noteB == null || relationType == null) {
            throw new IllegalArgumentException("relation requires noteA, noteB and relationType");
        }
        if (noteA.compareTo(noteB) >= 0) {
            throw new IllegalArgumentException("relation notes must be in canonical order: " + noteA + ", " + noteB);
        }
    }

    @JsonIgnore
    public String key() {
        return NoteIds.canonicalKey(noteA, noteB);
    }

    public boolean involves(String noteId) {
        return noteA.equals(noteId) || noteB.equals(noteId);
    }
}
