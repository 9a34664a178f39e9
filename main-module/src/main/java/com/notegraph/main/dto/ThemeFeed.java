package com.notegraph.main.dto;

import com.notegraph.common.model.ParsedNote;
import com.notegraph.common.model.Tension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Clusters with member note contents, for theme synthesis.
 */
public record ThemeFeed(List<ClusterNotes> clusters, List<Tension> tensions,
                        int clusterCount, int noteCount, int tensionCount, Instant computedAt) {

    /**
     * @param notes contents of members whose document exists
     */
    public record ClusterNotes(String id, List<String> noteIds, Map<String, ParsedNote> notes) {
    }
}
