package com.notegraph.common.model;

import java.time.Instant;
import java.util.List;

/**
 * An atomic note as stored in its own markdown document.
 */
public record Note(
    String id,
    String content,
    NoteMetadata metadata,
    Instant createdAt,
    Instant updatedAt,
    List<BacklinkEntry> links
) {
    public Note {
        if (id == null || content == null) {
            throw new IllegalArgumentException("note requires id and content");
        }
        metadata = metadata == null ? NoteMetadata.empty() : metadata;
        links = links == null ? List.of() : List.copyOf(links);
    }

    public Note withLinks(List<BacklinkEntry> newLinks) {
        return new Note(id, content, metadata, createdAt, updatedAt, newLinks);
    }
}
