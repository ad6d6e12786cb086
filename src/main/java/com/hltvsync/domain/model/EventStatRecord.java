package com.hltvsync.domain.model;

import java.util.Map;
import java.util.Set;

/**
 * Per-event statistics of one player. The nickname is only used to stub a missing player.
 */
public record EventStatRecord(
        long eventId,
        long playerId,
        String nickname,
        Double rating,
        Integer mapsPlayed,
        Double kdRatio,
        Set<String> emptyFields) implements ExtractedRecord {

    public EventStatRecord {
        emptyFields = emptyFields == null ? Set.of() : Set.copyOf(emptyFields);
    }

    @Override
    public Map<String, Object> key() {
        return Map.of("eventId", eventId, "playerId", playerId);
    }

    @Override
    public Map<String, Object> fields() {
        return RecordFields.with(emptyFields)
            .put("rating", rating)
            .put("mapsPlayed", mapsPlayed)
            .put("kdRatio", kdRatio)
            .build();
    }
}
