package com.notegraph.common.serialization;

import com.notegraph.common.model.BacklinkEntry;
import com.notegraph.common.model.Note;
import com.notegraph.common.model.NoteMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Сериализатор заметки в markdown с YAML frontmatter.
 * Формат:
 * <pre>
 * ---
 * id: 20260222T153045-a1b2c3d4
 * title: "..."            (optional)
 * type: meta              (optional)
 * tags: ["a", "b"]        (optional)
 * source: "..."           (optional)
 * created: ISO-8601
 * updated: ISO-8601
 * links:                  (optional)
 *   - target: ...
 *     similarity: 0.9
 * ---
 *
 * body
 * </pre>
 */
public class NoteMarkdownSerializer {

    static final String DELIMITER = "---";

    public String serialize(Note note) {
        if (note == null) {
            throw new IllegalArgumentException("Note cannot be null");
        }

        List<String> lines = new ArrayList<>();
        lines.add(DELIMITER);
        lines.add("id: " + note.id());

        NoteMetadata metadata = note.metadata();
        if (hasText(metadata.title())) {
            lines.add("title: \"" + metadata.title() + "\"");
        }
        if (metadata.type() != null) {
            lines.add("type: " + metadata.type().label());
        }
        if (!metadata.tags().isEmpty()) {
            lines.add("tags: [" + metadata.tags().stream()
                    .map(tag -> "\"" + tag + "\"")
                    .collect(Collectors.joining(", ")) + "]");
        }
        if (hasText(metadata.source())) {
            lines.add("source: \"" + metadata.source() + "\"");
        }

        lines.add("created: " + note.createdAt());
        lines.add("updated: " + note.updatedAt());

        if (!note.links().isEmpty()) {
            lines.add("links:");
            for (BacklinkEntry link : note.links()) {
                lines.add("  - target: " + link.targetId());
                lines.add("    similarity: " + link.similarity());
            }
        }

        lines.add(DELIMITER);

        return String.join("\n", lines) + "\n\n" + note.content() + "\n";
    }

    public String notePath(String notesDir, String noteId) {
        return notesDir + "/" + noteId + ".md";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
