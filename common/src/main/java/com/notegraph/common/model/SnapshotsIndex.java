package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only timeline, oldest first.
 */
public record SnapshotsIndex(
    @JsonProperty("snapshots")
    List<GraphSnapshot> snapshots
) {
    @JsonCreator
    public SnapshotsIndex {
        if (snapshots == null) {
            throw new IllegalArgumentException("snapshots list is required");
        }
        IndexChecks.requireElements(snapshots, "snapshots");
    }

    public static SnapshotsIndex empty() {
        return new SnapshotsIndex(new ArrayList<>());
    }

    public SnapshotsIndex append(GraphSnapshot snapshot) {
        snapshots.add(snapshot);
        return this;
    }
}
