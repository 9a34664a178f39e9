package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record TensionsIndex(
    @JsonProperty("tensions")
    Map<String, Tension> tensions,

    @JsonProperty("computedAt")
    Instant computedAt
) {
    @JsonCreator
    public TensionsIndex {
        if (tensions == null) {
            throw new IllegalArgumentException("tensions map is required");
        }
        IndexChecks.requireEntries(tensions, "tensions");
    }

    public static TensionsIndex empty() {
        return new TensionsIndex(new LinkedHashMap<>(), Instant.now());
    }
}
