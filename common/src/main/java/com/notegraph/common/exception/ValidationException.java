package com.notegraph.common.exception;

/**
 * Rejected input. Always raised before anything is written to the document store.
 */
public class ValidationException extends NoteGraphException {

    public ValidationException(String message) {
        super(message);
    }
}
