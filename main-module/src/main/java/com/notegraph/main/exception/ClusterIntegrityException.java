package com.notegraph.main.exception;

import com.notegraph.common.exception.NoteGraphException;
import lombok.Getter;

/**
 * A note is listed as a member of more than one cluster.
 */
@Getter
public class ClusterIntegrityException extends NoteGraphException {

    private final String noteId;

    public ClusterIntegrityException(String noteId, String firstClusterId, String secondClusterId) {
        super("Note " + noteId + " belongs to both " + firstClusterId + " and " + secondClusterId);
        this.noteId = noteId;
    }
}
