package com.notegraph.common.model;

import java.util.List;

/**
 * Optional descriptive fields of a note. Every component may be null except {@code tags}.
 */
public record NoteMetadata(String title, NoteType type, List<String> tags, String source) {

    public NoteMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static NoteMetadata empty() {
        return new NoteMetadata(null, null, List.of(), null);
    }

    public static NoteMetadata ofType(NoteType type) {
        return new NoteMetadata(null, type, List.of(), null);
    }
}
