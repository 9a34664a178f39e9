package com.notegraph.storage.exception;

import com.notegraph.common.exception.NoteGraphException;
import lombok.Getter;

@Getter
public class RetryExhaustedException extends NoteGraphException {

    private final String path;
    private final int attempts;

    public RetryExhaustedException(String path, int attempts, Throwable lastConflict) {
        super("Failed to update " + path + " after " + attempts + " attempts", lastConflict);
        this.path = path;
        this.attempts = attempts;
    }
}
