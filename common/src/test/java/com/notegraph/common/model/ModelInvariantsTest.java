package com.notegraph.common.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ModelInvariantsTest {

    @Test
    void testCanonicalKeyIsOrderIndependent() {
        assertEquals("a:b", NoteIds.canonicalKey("a", "b"));
        assertEquals("a:b", NoteIds.canonicalKey("b", "a"));
        assertEquals("a", NoteIds.first("b", "a"));
        assertEquals("b", NoteIds.second("b", "a"));
    }

    @Test
    void testNoteIdPattern() {
        assertTrue(NoteIds.isValid("20260222T153045-a1b2c3d4"));
        assertFalse(NoteIds.isValid("20260222T153045-A1B2C3D4"));
        assertFalse(NoteIds.isValid("2026-02-22-a1b2c3d4"));
        assertFalse(NoteIds.isValid(null));
    }

    @Test
    void testTensionRequiresCanonicalOrder() {
        assertThrows(IllegalArgumentException.class,
                () -> new Tension("tension-0", "b", "a", 0.5, "cluster-0", Instant.EPOCH));
    }

    @Test
    void testRelationKeyAndLabels() {
        TypedRelation relation = new TypedRelation("a", "b", RelationType.IS_EXAMPLE_OF, "because", 0.9, Instant.EPOCH);

        assertEquals("a:b", relation.key());
        assertTrue(relation.involves("b"));
        assertFalse(relation.involves("c"));
        assertEquals(RelationType.IS_EXAMPLE_OF, RelationType.fromLabel("is-example-of"));
        assertTrue(RelationType.find("unrelated").isEmpty());
    }

    @Test
    void testDecayScoreBounds() {
        assertThrows(IllegalArgumentException.class,
                () -> new DecayRecord("a", 1.2, java.util.List.of(), Instant.EPOCH));
    }
}
