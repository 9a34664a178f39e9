package com.notegraph.common.serialization;

import com.notegraph.common.model.NoteType;
import com.notegraph.common.model.ParsedNote;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a stored note document back into title, type and body.
 * A document without a frontmatter block is treated as all body.
 */
public class NoteMarkdownDeserializer {

    private static final Pattern DOCUMENT = Pattern.compile("^---\\n([\\s\\S]*?)\\n---\\n\\n?([\\s\\S]*)$");
    private static final Pattern TITLE = Pattern.compile("^title:\\s*\"?(.+?)\"?\\s*$", Pattern.MULTILINE);
    private static final Pattern TYPE = Pattern.compile("^type:\\s*(\\S+)\\s*$", Pattern.MULTILINE);

    public ParsedNote deserialize(String markdown) {
        if (markdown == null) {
            throw new IllegalArgumentException("Markdown cannot be null");
        }

        Matcher document = DOCUMENT.matcher(markdown);
        if (!document.matches()) {
            return new ParsedNote(null, null, markdown.trim());
        }

        String frontmatter = document.group(1);
        String body = document.group(2).trim();

        Matcher title = TITLE.matcher(frontmatter);
        Matcher type = TYPE.matcher(frontmatter);

        // неизвестные типы игнорируются
        NoteType noteType = type.find() ? NoteType.find(type.group(1)).orElse(null) : null;

        return new ParsedNote(title.find() ? title.group(1) : null, noteType, body);
    }
}
