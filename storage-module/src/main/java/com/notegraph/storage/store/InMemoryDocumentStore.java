package com.notegraph.storage.store;

import com.google.common.hash.Hashing;
import com.notegraph.storage.exception.VersionConflictException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of DocumentStore with the same optimistic versioning rules as the remote store.
 * Versions are content hashes salted with a write counter, so rewriting identical content still changes the version.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final ConcurrentHashMap<String, StoredDocument> documents = new ConcurrentHashMap<>();
    private final AtomicLong writeCounter = new AtomicLong();

    @Override
    public Mono<StoredDocument> get(String path) {
        return Mono.fromCallable(() -> documents.get(path))
                .doOnNext(document -> log.debug("Read {} at version {}", path, document.version()));
    }

    @Override
    public Mono<String> put(String path, String content, String expectedVersion) {
        return Mono.fromCallable(() -> {
            StoredDocument written = documents.compute(path, (key, current) -> {
                String currentVersion = current == null ? null : current.version();
                if (!Objects.equals(currentVersion, expectedVersion)) {
                    throw new VersionConflictException(path, 409, expectedVersion);
                }
                return new StoredDocument(content, versionOf(content));
            });
            log.debug("Wrote {} at version {}", path, written.version());
            return written.version();
        });
    }

    public List<String> paths() {
        return new ArrayList<>(documents.keySet());
    }

    private String versionOf(String content) {
        return Hashing.sha256()
                .newHasher()
                .putLong(writeCounter.incrementAndGet())
                .putString(content, StandardCharsets.UTF_8)
                .hash()
                .toString()
                .substring(0, 40);
    }
}
