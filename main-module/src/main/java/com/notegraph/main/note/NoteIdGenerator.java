package com.notegraph.main.note;

import java.time.Instant;

public interface NoteIdGenerator {

    String generate(String normalizedContent, Instant createdAt);
}
