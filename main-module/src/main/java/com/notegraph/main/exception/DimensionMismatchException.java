package com.notegraph.main.exception;

import com.notegraph.common.exception.NoteGraphException;

public class DimensionMismatchException extends NoteGraphException {

    public DimensionMismatchException(int left, int right) {
        super("Vector length mismatch: " + left + " vs " + right);
    }
}
