package com.notegraph.main.snapshot;

import com.notegraph.common.model.GraphSnapshot;

public record SnapshotDelta(int noteDelta, int linkDelta, int clusterDelta, int tensionDelta, int decayDelta) {

    public static SnapshotDelta between(GraphSnapshot previous, GraphSnapshot current) {
        return new SnapshotDelta(
                current.noteCount() - previous.noteCount(),
                current.linkCount() - previous.linkCount(),
                current.clusterCount() - previous.clusterCount(),
                current.tensionCount() - previous.tensionCount(),
                current.decayCount() - previous.decayCount());
    }
}
