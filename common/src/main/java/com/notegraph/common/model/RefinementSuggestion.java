package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One advisory suggestion for a note, stored under {@code noteId:type}. A newer suggestion of the same type replaces it.
 */
public record RefinementSuggestion(
    @JsonProperty("id")
    String id,

    @JsonProperty("noteId")
    String noteId,

    @JsonProperty("type")
    RefinementType type,

    @JsonProperty("suggestion")
    String suggestion,

    @JsonProperty("reason")
    String reason,

    @JsonProperty("relatedNoteIds")
    List<String> relatedNoteIds,

    @JsonProperty("generatedAt")
    Instant generatedAt
) {
    @JsonCreator
    public RefinementSuggestion {
        if (noteId == null || type == null) {
            throw new IllegalArgumentException("refinement suggestion requires noteId and type");
        }
        if (!keyOf(noteId, type).equals(id)) {
            throw new IllegalArgumentException("refinement id " + id + " does not match " + keyOf(noteId, type));
        }
        relatedNoteIds = relatedNoteIds == null ? List.of() : List.copyOf(relatedNoteIds);
    }

    public static RefinementSuggestion of(String noteId, RefinementType type, String suggestion, String reason,
                                          List<String> relatedNoteIds, Instant generatedAt) {
        return new RefinementSuggestion(keyOf(noteId, type), noteId, type, suggestion, reason, relatedNoteIds, generatedAt);
    }

    public static String keyOf(String noteId, RefinementType type) {
        return noteId + ":" + type.label();
    }
}
