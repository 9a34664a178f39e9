package com.notegraph.main.dto;

import com.notegraph.main.snapshot.SnapshotTimeline;

import java.time.Instant;
import java.util.List;

public record AnalyticsResult(List<SnapshotTimeline.Entry> snapshots, int snapshotCount, Instant since) {
}
