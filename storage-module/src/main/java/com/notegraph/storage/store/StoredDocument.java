package com.notegraph.storage.store;

/**
 * Document content together with the version token it was read at.
 */
public record StoredDocument(String content, String version) {

    public StoredDocument {
        if (content == null || version == null) {
            throw new IllegalArgumentException("content and version are required");
        }
    }
}
