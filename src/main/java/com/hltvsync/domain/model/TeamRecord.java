package com.hltvsync.domain.model;

import java.util.Map;
import java.util.Set;

public record TeamRecord(
        long teamId,
        String name,
        String country,
        Integer worldRank,
        Set<String> emptyFields) implements ExtractedRecord {

    public TeamRecord {
        emptyFields = emptyFields == null ? Set.of() : Set.copyOf(emptyFields);
    }

    public static TeamRecord stub(long teamId, String name) {
        return new TeamRecord(teamId, name, null, null, Set.of());
    }

    @Override
    public Map<String, Object> key() {
        return Map.of("teamId", teamId);
    }

    @Override
    public Map<String, Object> fields() {
        return RecordFields.with(emptyFields)
            .put("name", name)
            .put("country", country)
            .put("worldRank", worldRank)
            .build();
    }
}
