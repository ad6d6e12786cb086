package com.hltvsync.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Player identity and, when read from a profile page, aggregate stats.
 * The current team is a weak reference: only its id is kept.
 */
public record PlayerRecord(
        long playerId,
        String nickname,
        String realName,
        String country,
        Integer age,
        Long currentTeamId,
        PlayerStats stats,
        Set<String> emptyFields) implements ExtractedRecord {

    public PlayerRecord {
        emptyFields = emptyFields == null ? Set.of() : Set.copyOf(emptyFields);
    }

    public static PlayerRecord stub(long playerId, String nickname) {
        return new PlayerRecord(playerId, nickname, null, null, null, null, null, Set.of());
    }

    @Override
    public Map<String, Object> key() {
        return Map.of("playerId", playerId);
    }

    @Override
    public Map<String, Object> fields() {
        RecordFields fields = RecordFields.with(emptyFields)
            .put("nickname", nickname)
            .put("realName", realName)
            .put("country", country)
            .put("age", age)
            .put("currentTeamId", currentTeamId);
        if (stats != null && stats.hasAnyValue()) {
            fields.put("stats", statsDocument(stats));
        }
        return fields.build();
    }

    /**
     * One nested document per profile fetch, replaced whole. Values missing from that fetch
     * are stored as null.
     */
    private static Map<String, Object> statsDocument(PlayerStats stats) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("kills", stats.kills());
        document.put("deaths", stats.deaths());
        document.put("kdRatio", stats.kdRatio());
        document.put("rating", stats.rating());
        document.put("kast", stats.kast());
        document.put("adr", stats.adr());
        document.put("kpr", stats.kpr());
        document.put("impact", stats.impact());
        document.put("headshotPercentage", stats.headshotPercentage());
        document.put("mapsPlayed", stats.mapsPlayed());
        document.put("roundsPlayed", stats.roundsPlayed());
        document.put("capturedAt", stats.capturedAt() == null ? null : stats.capturedAt().toString());
        return document;
    }
}
