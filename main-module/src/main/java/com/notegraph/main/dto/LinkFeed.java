package com.notegraph.main.dto;

import com.notegraph.common.model.ParsedNote;
import com.notegraph.common.model.TypedRelation;

import java.time.Instant;
import java.util.List;

/**
 * Linked note pairs for relation classification.
 *
 * @param classifiedCount classified pairs among all linked pairs, before any unclassified-only filter
 */
public record LinkFeed(List<Pair> pairs, int pairCount, int classifiedCount, Instant computedAt) {

    /**
     * Contents are null when the note document is missing; relation is null when unclassified.
     */
    public record Pair(String noteA, String noteB, double similarity,
                       ParsedNote noteAContent, ParsedNote noteBContent, TypedRelation relation) {
    }
}
