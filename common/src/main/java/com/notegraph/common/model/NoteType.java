package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum NoteType {
    /** synthesis of a cluster */
    META("meta"),
    HYPOTHESIS("hypothesis");

    private final String label;

    NoteType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<NoteType> find(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equals(label))
                .findFirst();
    }

    @JsonCreator
    public static NoteType fromLabel(String label) {
        return find(label).orElseThrow(() -> new IllegalArgumentException("Unknown note type: " + label));
    }
}
