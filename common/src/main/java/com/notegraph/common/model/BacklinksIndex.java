package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional adjacency list. Entry A->B exists iff B->A exists with the same similarity.
 * The map and its lists are mutable; symmetric mutation goes through the graph maintainer.
 */
public record BacklinksIndex(
    @JsonProperty("links")
    Map<String, List<BacklinkEntry>> links
) {
    @JsonCreator
    public BacklinksIndex {
        if (links == null) {
            throw new IllegalArgumentException("links map is required");
        }
        IndexChecks.requireEntries(links, "links");
        links.forEach((noteId, entries) -> IndexChecks.requireElements(entries, "links of " + noteId));
    }

    public static BacklinksIndex empty() {
        return new BacklinksIndex(new LinkedHashMap<>());
    }

    public List<BacklinkEntry> linksOf(String noteId) {
        return links.getOrDefault(noteId, List.of());
    }

    public int linkCount(String noteId) {
        return linksOf(noteId).size();
    }
}
