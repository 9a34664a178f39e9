package com.notegraph.common.exception;

/**
 * Root of all failures raised by the note graph engine.
 */
public class NoteGraphException extends RuntimeException {

    public NoteGraphException(String message) {
        super(message);
    }

    public NoteGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
