package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record ExplorationsIndex(
    @JsonProperty("suggestions")
    List<ExplorationSuggestion> suggestions,

    @JsonProperty("computedAt")
    Instant computedAt
) {
    @JsonCreator
    public ExplorationsIndex {
        if (suggestions == null) {
            throw new IllegalArgumentException("suggestions list is required");
        }
        IndexChecks.requireElements(suggestions, "suggestions");
    }

    public static ExplorationsIndex empty() {
        return new ExplorationsIndex(new ArrayList<>(), Instant.now());
    }
}
