package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notes whose decay score reached the threshold. Absence means healthy, not unscored.
 */
public record DecayIndex(
    @JsonProperty("records")
    Map<String, DecayRecord> records,

    @JsonProperty("computedAt")
    Instant computedAt
) {
    @JsonCreator
    public DecayIndex {
        if (records == null) {
            throw new IllegalArgumentException("records map is required");
        }
        IndexChecks.requireEntries(records, "records");
    }

    public static DecayIndex empty() {
        return new DecayIndex(new LinkedHashMap<>(), Instant.now());
    }
}
