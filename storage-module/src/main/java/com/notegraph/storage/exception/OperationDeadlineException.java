package com.notegraph.storage.exception;

import com.notegraph.common.exception.NoteGraphException;
import lombok.Getter;

import java.time.Duration;

/**
 * The caller's deadline passed before the next update attempt could start.
 */
@Getter
public class OperationDeadlineException extends NoteGraphException {

    private final String path;
    private final int completedAttempts;

    public OperationDeadlineException(String path, Duration deadline, int completedAttempts) {
        super("Deadline of " + deadline.toMillis() + "ms exceeded while updating " + path
                + " after " + completedAttempts + " attempts");
        this.path = path;
        this.completedAttempts = completedAttempts;
    }
}
