package com.hltvsync.application.usecase;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldMergerTest {

    @Test
    void testNonNullValueReplacesStoredValue() {
        FieldMerger.MergeResult result = FieldMerger.merge(
            Map.of("eventId", 7148L, "prizePool", "TBA soon"),
            Map.of("prizePool", "$1,000,000"));

        assertTrue(result.changed());
        assertEquals("$1,000,000", result.row().get("prizePool"));
        assertEquals(7148L, result.row().get("eventId"));
    }

    @Test
    void testAbsentFieldKeepsStoredValue() {
        FieldMerger.MergeResult result = FieldMerger.merge(
            Map.of("name", "Vitality", "worldRank", 2),
            Map.of("name", "Vitality"));

        assertFalse(result.changed());
        assertEquals(2, result.row().get("worldRank"));
    }

    @Test
    void testExplicitNullNeverOverwritesValue() {
        Map<String, Object> incoming = new HashMap<>();
        incoming.put("currentTeamId", null);

        FieldMerger.MergeResult result = FieldMerger.merge(Map.of("currentTeamId", 9565L), incoming);

        assertFalse(result.changed());
        assertEquals(9565L, result.row().get("currentTeamId"));
    }

    @Test
    void testExplicitNullIsRecordedWhenFieldIsNew() {
        Map<String, Object> incoming = new LinkedHashMap<>();
        incoming.put("prizePool", null);

        FieldMerger.MergeResult result = FieldMerger.merge(Map.of("name", "CCT Season 2"), incoming);

        assertTrue(result.changed());
        assertTrue(result.row().containsKey("prizePool"));
        assertNull(result.row().get("prizePool"));
    }

    @Test
    void testStoredNullIsFilledByValue() {
        Map<String, Object> existing = new HashMap<>();
        existing.put("prizePool", null);

        FieldMerger.MergeResult result = FieldMerger.merge(existing, Map.of("prizePool", "$250,000"));

        assertTrue(result.changed());
        assertEquals("$250,000", result.row().get("prizePool"));
    }
}
