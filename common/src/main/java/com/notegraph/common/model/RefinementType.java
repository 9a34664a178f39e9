package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of advisory edits an agent may propose for a note. Notes are never changed automatically.
 */
public enum RefinementType {
    RETITLE("retitle"),
    SPLIT("split"),
    MERGE_SUGGEST("merge-suggest"),
    UPDATE("update");

    private final String label;

    RefinementType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<RefinementType> find(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equals(label))
                .findFirst();
    }

    @JsonCreator
    public static RefinementType fromLabel(String label) {
        return find(label).orElseThrow(() -> new IllegalArgumentException("Unknown refinement type: " + label));
    }
}
