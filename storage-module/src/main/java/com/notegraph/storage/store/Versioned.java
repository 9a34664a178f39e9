package com.notegraph.storage.store;

/**
 * A decoded value and the version it was read or written at. {@code version} is null for a
 * document that does not exist yet.
 */
public record Versioned<T>(T value, String version) {

    public boolean exists() {
        return version != null;
    }
}
