package com.notegraph.common.exception;

import lombok.Getter;

/**
 * An index document could not be decoded into its schema.
 * Hand-edited or partially written documents end up here.
 */
@Getter
public class IndexFormatException extends NoteGraphException {

    private final String path;

    public IndexFormatException(String path, String message, Throwable cause) {
        super("Malformed index document " + path + ": " + message, cause);
        this.path = path;
    }
}
