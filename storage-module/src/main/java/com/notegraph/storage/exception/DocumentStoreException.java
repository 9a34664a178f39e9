package com.notegraph.storage.exception;

import com.notegraph.common.exception.NoteGraphException;
import lombok.Getter;

/**
 * Any non-conflict failure talking to the document store: network, auth, 5xx, unexpected payload.
 * Never retried.
 */
@Getter
public class DocumentStoreException extends NoteGraphException {

    private final String path;

    /** HTTP status when the failure came from a response, otherwise null */
    private final Integer status;

    public DocumentStoreException(String path, Integer status, String message) {
        super(message);
        this.path = path;
        this.status = status;
    }

    public DocumentStoreException(String path, Integer status, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.status = status;
    }
}
