package com.notegraph.main.dto;

import com.notegraph.common.model.DecayRecord;
import com.notegraph.common.model.ParsedNote;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Clusters with member contents and decay records, for agents that propose refinements.
 *
 * @param computedAt when the clusters index was computed
 */
public record RefinementFeed(List<ClusterNotes> clusters, int clusterCount, int noteCount, Instant computedAt) {

    /**
     * @param notes members whose document exists
     */
    public record ClusterNotes(String id, int memberCount, Map<String, NoteWithDecay> notes) {
    }

    /**
     * @param decay null when the note is not flagged as decaying
     */
    public record NoteWithDecay(ParsedNote note, DecayRecord decay) {
    }
}
