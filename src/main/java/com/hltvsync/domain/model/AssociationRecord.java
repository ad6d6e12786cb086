package com.hltvsync.domain.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Association between two entities.
 *
 * EVENT_TEAM rows are keyed by the pair and overwritten with the latest attributes.
 * TEAM_PLAYER rows also carry the observation day, so each day adds a history row.
 * An attribute mapped to null is intentionally empty; an absent attribute was not observed.
 */
public record AssociationRecord(
        AssociationKind kind,
        long leftId,
        long rightId,
        LocalDate observedOn,
        Map<String, Object> attributes) implements ExtractedRecord {

    public AssociationRecord {
        if (kind == null) {
            throw new IllegalArgumentException("Association kind is required");
        }
        if (kind == AssociationKind.TEAM_PLAYER && observedOn == null) {
            throw new IllegalArgumentException("Roster entries need an observation day");
        }
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static AssociationRecord eventTeam(long eventId, long teamId, Map<String, Object> attributes) {
        return new AssociationRecord(AssociationKind.EVENT_TEAM, eventId, teamId, null, attributes);
    }

    public static AssociationRecord teamPlayer(long teamId, long playerId, LocalDate observedOn,
                                               Map<String, Object> attributes) {
        return new AssociationRecord(AssociationKind.TEAM_PLAYER, teamId, playerId, observedOn, attributes);
    }

    @Override
    public Set<String> emptyFields() {
        return attributes.entrySet().stream()
            .filter(e -> e.getValue() == null)
            .map(Map.Entry::getKey)
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Map<String, Object> key() {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put(kind.getLeftField(), leftId);
        key.put(kind.getRightField(), rightId);
        if (kind == AssociationKind.TEAM_PLAYER) {
            key.put("observedOn", observedOn.toString());
        }
        return Collections.unmodifiableMap(key);
    }

    @Override
    public Map<String, Object> fields() {
        RecordFields fields = RecordFields.with(emptyFields());
        attributes.forEach(fields::put);
        return fields.build();
    }
}
