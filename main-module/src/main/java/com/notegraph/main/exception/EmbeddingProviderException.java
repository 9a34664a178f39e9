package com.notegraph.main.exception;

import com.notegraph.common.exception.NoteGraphException;

public class EmbeddingProviderException extends NoteGraphException {

    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
