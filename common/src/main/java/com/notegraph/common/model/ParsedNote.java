package com.notegraph.common.model;

/**
 * What a stored note document yields when read back: title and type from frontmatter, plus body.
 */
public record ParsedNote(String title, NoteType type, String body) {

    public boolean isMeta() {
        return type == NoteType.META;
    }
}
