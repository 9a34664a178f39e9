package com.notegraph.common.model;

import java.util.regex.Pattern;

/**
 * Helpers for note identifiers and unordered note pairs.
 */
public final class NoteIds {

    /** {@code yyyyMMdd'T'HHmmss-<8 hex>} */
    public static final Pattern NOTE_ID_PATTERN = Pattern.compile("^\\d{8}T\\d{6}-[0-9a-f]{8}$");

    private static final String PAIR_SEPARATOR = ":";

    private NoteIds() {
    }

    public static boolean isValid(String noteId) {
        return noteId != null && NOTE_ID_PATTERN.matcher(noteId).matches();
    }

    /**
     * Canonical key of an unordered pair: the lexicographically smaller id first.
     */
    public static String canonicalKey(String a, String b) {
        return a.compareTo(b) < 0 ? a + PAIR_SEPARATOR + b : b + PAIR_SEPARATOR + a;
    }

    public static String first(String a, String b) {
        return a.compareTo(b) < 0 ? a : b;
    }

    public static String second(String a, String b) {
        return a.compareTo(b) < 0 ? b : a;
    }
}
