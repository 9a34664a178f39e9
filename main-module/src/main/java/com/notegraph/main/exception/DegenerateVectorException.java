package com.notegraph.main.exception;

import com.notegraph.common.exception.NoteGraphException;

/**
 * Cosine similarity is undefined for empty or zero-magnitude vectors.
 */
public class DegenerateVectorException extends NoteGraphException {

    public DegenerateVectorException(String message) {
        super(message);
    }
}
