package com.notegraph.main.note;

import com.notegraph.common.exception.ValidationException;
import com.notegraph.common.model.Note;
import com.notegraph.common.model.NoteMetadata;
import com.notegraph.common.model.NoteType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Builds notes from raw user input. No I/O.
 */
@Component
@RequiredArgsConstructor
public class NoteFactory {

    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private final NoteIdGenerator noteIdGenerator;
    private final Clock clock;

    /**
     * Trims and collapses runs of three or more newlines into one blank line.
     */
    public static String normalizeContent(String raw) {
        return EXCESS_BLANK_LINES.matcher(raw.trim()).replaceAll("\n\n");
    }

    /**
     * @param type optional note type, null for a plain note
     * @throws ValidationException if the content is empty after normalization
     */
    public Note create(String rawContent, NoteType type) {
        if (rawContent == null) {
            throw new ValidationException("Note content is required");
        }
        String content = normalizeContent(rawContent);
        if (content.isEmpty()) {
            throw new ValidationException("Cannot create a note with empty content");
        }

        Instant now = clock.instant();
        String id = noteIdGenerator.generate(content, now);
        NoteMetadata metadata = type == null ? NoteMetadata.empty() : NoteMetadata.ofType(type);
        return new Note(id, content, metadata, now, now, List.of());
    }
}
