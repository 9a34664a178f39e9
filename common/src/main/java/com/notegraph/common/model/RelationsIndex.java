package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * canonical pair key -> relation. Upserted, never expired.
 */
public record RelationsIndex(
    @JsonProperty("relations")
    Map<String, TypedRelation> relations,

    @JsonProperty("updatedAt")
    Instant updatedAt
) {
    @JsonCreator
    public RelationsIndex {
        if (relations == null) {
            throw new IllegalArgumentException("relations map is required");
        }
        IndexChecks.requireEntries(relations, "relations");
    }

    public static RelationsIndex empty() {
        return new RelationsIndex(new LinkedHashMap<>(), Instant.now());
    }

    public RelationsIndex withUpdatedAt(Instant timestamp) {
        return new RelationsIndex(relations, timestamp);
    }
}
