package com.notegraph.main.snapshot;

import com.notegraph.common.model.GraphSnapshot;
import com.notegraph.common.model.SnapshotsIndex;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Filters the snapshot series and attaches per-entry deltas.
 */
@Component
public class SnapshotTimeline {

    /**
     * @param since keep snapshots captured at or after this instant; null keeps all
     * @return entries in stored order; the first entry of the filtered series has a null delta
     */
    public List<Entry> timeline(SnapshotsIndex index, Instant since) {
        List<GraphSnapshot> filtered = index.snapshots().stream()
                .filter(snapshot -> since == null || !snapshot.capturedAt().isBefore(since))
                .toList();

        List<Entry> entries = new ArrayList<>(filtered.size());
        for (int i = 0; i < filtered.size(); i++) {
            SnapshotDelta delta = i == 0 ? null : SnapshotDelta.between(filtered.get(i - 1), filtered.get(i));
            entries.add(new Entry(filtered.get(i), delta));
        }
        return entries;
    }

    public record Entry(GraphSnapshot snapshot, SnapshotDelta delta) {
    }
}
