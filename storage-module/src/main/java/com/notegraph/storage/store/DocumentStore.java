package com.notegraph.storage.store;

import reactor.core.publisher.Mono;

/**
 * Remote version-controlled blob store with per-document optimistic versioning.
 * Implementations never retry.
 */
public interface DocumentStore {

    /**
     * Reads a document.
     *
     * @param path document path, e.g. {@code index/backlinks.json}
     * @return the document, or an empty Mono if it does not exist
     */
    Mono<StoredDocument> get(String path);

    /**
     * Writes a document.
     *
     * @param path            document path
     * @param content         full new content
     * @param expectedVersion version read before the write, or null to create
     * @return the new version token. Fails with
     *         {@link com.notegraph.storage.exception.VersionConflictException} on a stale version,
     *         {@link com.notegraph.storage.exception.DocumentStoreException} on anything else
     */
    Mono<String> put(String path, String content, String expectedVersion);
}
