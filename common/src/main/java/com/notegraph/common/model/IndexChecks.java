package com.notegraph.common.model;

import java.util.Collection;
import java.util.Map;

/**
 * Structural checks shared by the index records' creators. A decoded index with a null entry is malformed.
 */
final class IndexChecks {

    private IndexChecks() {
    }

    static void requireEntries(Map<String, ?> map, String name) {
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException(name + " entry '" + entry.getKey() + "' is null");
            }
        }
    }

    static void requireElements(Collection<?> elements, String name) {
        for (Object element : elements) {
            if (element == null) {
                throw new IllegalArgumentException(name + " contains a null element");
            }
        }
    }
}
