package com.notegraph.main.graph;

import com.notegraph.common.model.BacklinkEntry;
import com.notegraph.common.model.BacklinksIndex;
import com.notegraph.main.similarity.SimilarityMatch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Symmetric mutation of the backlinks adjacency list. Every operation writes both directions,
 * so {@code A -> B (s)} exists iff {@code B -> A (s)} exists.
 */
@Component
public class GraphMaintainer {

    public List<BacklinkEntry> getLinks(BacklinksIndex index, String noteId) {
        return index.linksOf(noteId);
    }

    /**
     * Inserts or overwrites the link in both directions. Self links are ignored.
     */
    public void addLink(BacklinksIndex index, String noteA, String noteB, double similarity) {
        if (noteA.equals(noteB)) {
            return;
        }
        upsertDirected(index, noteA, noteB, similarity);
        upsertDirected(index, noteB, noteA, similarity);
    }

    public void removeLink(BacklinksIndex index, String noteA, String noteB) {
        removeDirected(index, noteA, noteB);
        removeDirected(index, noteB, noteA);
    }

    /**
     * Adds or refreshes links from {@code sourceId} to each match. Never removes links.
     */
    public void applyMatches(BacklinksIndex index, String sourceId, Collection<SimilarityMatch> matches) {
        for (SimilarityMatch match : matches) {
            addLink(index, sourceId, match.noteId(), match.similarity());
        }
    }

    /**
     * Builds a fresh index from a complete pair list.
     */
    public BacklinksIndex rebuildBacklinks(Collection<LinkPair> pairs) {
        BacklinksIndex index = BacklinksIndex.empty();
        for (LinkPair pair : pairs) {
            addLink(index, pair.noteA(), pair.noteB(), pair.similarity());
        }
        return index;
    }

    private void upsertDirected(BacklinksIndex index, String from, String to, double similarity) {
        List<BacklinkEntry> links = index.links().computeIfAbsent(from, id -> new ArrayList<>());
        BacklinkEntry entry = new BacklinkEntry(to, similarity);
        for (int i = 0; i < links.size(); i++) {
            if (links.get(i).targetId().equals(to)) {
                links.set(i, entry);
                return;
            }
        }
        links.add(entry);
    }

    private void removeDirected(BacklinksIndex index, String from, String to) {
        List<BacklinkEntry> links = index.links().get(from);
        if (links == null) {
            return;
        }
        links.removeIf(link -> link.targetId().equals(to));
        if (links.isEmpty()) {
            index.links().remove(from);
        }
    }
}
