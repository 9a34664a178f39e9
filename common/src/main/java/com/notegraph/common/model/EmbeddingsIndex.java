package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * noteId -> embedding. Upserted one record at a time.
 */
public record EmbeddingsIndex(
    @JsonProperty("embeddings")
    Map<String, EmbeddingRecord> embeddings
) {
    @JsonCreator
    public EmbeddingsIndex {
        if (embeddings == null) {
            throw new IllegalArgumentException("embeddings map is required");
        }
        IndexChecks.requireEntries(embeddings, "embeddings");
        embeddings.forEach((noteId, record) -> {
            if (!noteId.equals(record.noteId())) {
                throw new IllegalArgumentException("embedding stored under " + noteId + " belongs to " + record.noteId());
            }
        });
    }

    public static EmbeddingsIndex empty() {
        return new EmbeddingsIndex(new LinkedHashMap<>());
    }

    public int size() {
        return embeddings.size();
    }

    public EmbeddingsIndex upsert(EmbeddingRecord record) {
        embeddings.put(record.noteId(), record);
        return this;
    }
}
