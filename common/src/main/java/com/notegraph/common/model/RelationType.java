package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed vocabulary of typed semantic edges, read from noteA's perspective toward noteB.
 */
public enum RelationType {
    SUPPORTS("supports"),
    CONTRADICTS("contradicts"),
    REFINES("refines"),
    IS_EXAMPLE_OF("is-example-of"),
    CONTRASTS_WITH("contrasts-with");

    private final String label;

    RelationType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<RelationType> find(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equals(label))
                .findFirst();
    }

    @JsonCreator
    public static RelationType fromLabel(String label) {
        return find(label).orElseThrow(() -> new IllegalArgumentException("Unknown relation type: " + label));
    }
}
