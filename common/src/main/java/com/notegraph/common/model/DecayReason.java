package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Staleness signals contributing to a decay score.
 */
public enum DecayReason {
    /** zero backlinks */
    NO_LINKS("no-links"),
    /** fewer than two backlinks */
    LOW_LINK_DENSITY("low-link-density"),
    /** similarity to own cluster centroid below the outlier threshold */
    CLUSTER_OUTLIER("cluster-outlier"),
    /** not a member of any cluster */
    NO_CLUSTER("no-cluster");

    private final String label;

    DecayReason(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static DecayReason fromLabel(String label) {
        return Arrays.stream(values())
                .filter(reason -> reason.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown decay reason: " + label));
    }
}
