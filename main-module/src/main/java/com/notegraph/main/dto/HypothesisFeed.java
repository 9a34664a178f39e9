package com.notegraph.main.dto;

import com.notegraph.common.model.ParsedNote;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tensions with both notes' contents and the rest of their cluster, for hypothesis generation.
 */
public record HypothesisFeed(List<TensionNotes> tensions, int tensionCount, Instant computedAt) {

    public record TensionNotes(String id, String noteA, String noteB, double similarity, String clusterId,
                               ParsedNote noteAContent, ParsedNote noteBContent,
                               Map<String, ParsedNote> clusterNotes) {
    }
}
