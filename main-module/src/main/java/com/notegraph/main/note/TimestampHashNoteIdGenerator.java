package com.notegraph.main.note;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * {@code yyyyMMdd'T'HHmmss-<first 8 hex of sha256(content)>}, in UTC.
 * The timestamp keeps ids sortable; the hash separates notes created in the same second.
 */
public class TimestampHashNoteIdGenerator implements NoteIdGenerator {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss").withZone(ZoneOffset.UTC);

    @Override
    public String generate(String normalizedContent, Instant createdAt) {
        String hash = Hashing.sha256()
                .hashString(normalizedContent, StandardCharsets.UTF_8)
                .toString()
                .substring(0, 8);
        return TIMESTAMP.format(createdAt) + "-" + hash;
    }
}
