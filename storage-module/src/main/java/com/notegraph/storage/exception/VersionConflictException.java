package com.notegraph.storage.exception;

/**
 * The version supplied on write no longer matches the stored document.
 */
public class VersionConflictException extends DocumentStoreException {

    public VersionConflictException(String path, Integer status, String expectedVersion) {
        super(path, status, "Version conflict on " + path + " (expected version " + expectedVersion + ")");
    }

    public VersionConflictException(String path, Integer status, String expectedVersion, Throwable cause) {
        super(path, status, "Version conflict on " + path + " (expected version " + expectedVersion + ")", cause);
    }
}
