package com.hltvsync.domain.ports;

import java.util.List;

/**
 * Stored collections and the fields forming their unique key.
 */
public enum StoreCollection {
    EVENTS("events", List.of("eventId")),
    TEAMS("teams", List.of("teamId")),
    PLAYERS("players", List.of("playerId")),
    EVENT_STATS("event_stats", List.of("eventId", "playerId")),
    EVENT_TEAMS("event_teams", List.of("eventId", "teamId")),
    TEAM_PLAYERS("team_players", List.of("teamId", "playerId", "observedOn"));

    private final String collectionName;
    private final List<String> keyFields;

    StoreCollection(String collectionName, List<String> keyFields) {
        this.collectionName = collectionName;
        this.keyFields = keyFields;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public List<String> getKeyFields() {
        return keyFields;
    }

    /**
     * Id field of an entity collection.
     */
    public String getIdField() {
        return keyFields.get(0);
    }
}
