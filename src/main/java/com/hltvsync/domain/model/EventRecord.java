package com.hltvsync.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Event as seen on an overview or listing page.
 */
public record EventRecord(
        long eventId,
        String name,
        LocalDate startDate,
        LocalDate endDate,
        String location,
        String prizePool,
        EventType eventType,
        EventStatus status,
        Integer teamsCount,
        List<Map<String, Object>> brackets,
        Set<String> emptyFields) implements ExtractedRecord {

    public EventRecord {
        brackets = brackets == null ? null : List.copyOf(brackets);
        emptyFields = emptyFields == null ? Set.of() : Set.copyOf(emptyFields);
    }

    public static EventRecord stub(long eventId, String name) {
        return new EventRecord(eventId, name, null, null, null, null, null, null, null, null, Set.of());
    }

    @Override
    public Map<String, Object> key() {
        return Map.of("eventId", eventId);
    }

    @Override
    public Map<String, Object> fields() {
        return RecordFields.with(emptyFields)
            .put("name", name)
            .put("startDate", startDate)
            .put("endDate", endDate)
            .put("location", location)
            .put("prizePool", prizePool)
            .put("eventType", eventType)
            .put("status", status)
            .put("teamsCount", teamsCount)
            .put("brackets", brackets)
            .build();
    }
}
