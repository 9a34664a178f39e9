package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code noteId:type} -> suggestion. Upserted, never expired.
 */
public record RefinementsIndex(
    @JsonProperty("suggestions")
    Map<String, RefinementSuggestion> suggestions,

    @JsonProperty("updatedAt")
    Instant updatedAt
) {
    @JsonCreator
    public RefinementsIndex {
        if (suggestions == null) {
            throw new IllegalArgumentException("suggestions map is required");
        }
        IndexChecks.requireEntries(suggestions, "suggestions");
        suggestions.forEach((key, suggestion) -> {
            if (!key.equals(suggestion.id())) {
                throw new IllegalArgumentException("suggestion stored under " + key + " has id " + suggestion.id());
            }
        });
    }

    public static RefinementsIndex empty() {
        return new RefinementsIndex(new LinkedHashMap<>(), Instant.now());
    }

    public RefinementsIndex upsert(RefinementSuggestion suggestion) {
        suggestions.put(suggestion.id(), suggestion);
        return this;
    }

    public RefinementsIndex withUpdatedAt(Instant timestamp) {
        return new RefinementsIndex(suggestions, timestamp);
    }
}
