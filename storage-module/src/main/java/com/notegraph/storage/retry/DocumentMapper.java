package com.notegraph.storage.retry;

/**
 * Converts between a stored document's text and its in-memory value.
 */
public interface DocumentMapper<T> {

    /**
     * Decodes stored content. Fails with {@link com.notegraph.common.exception.IndexFormatException}
     * if the content does not match the schema.
     */
    T decode(String path, String content);

    /** Value to start from when the document does not exist yet. Must return a fresh instance. */
    T empty();

    String encode(T value);
}
