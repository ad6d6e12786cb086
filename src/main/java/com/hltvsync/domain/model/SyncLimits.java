package com.hltvsync.domain.model;

/**
 * Per-kind caps on planned units. Zero means unlimited.
 */
public record SyncLimits(int maxEvents, int maxTeams, int maxPlayers) {

    public SyncLimits {
        if (maxEvents < 0 || maxTeams < 0 || maxPlayers < 0) {
            throw new IllegalArgumentException("Limits cannot be negative");
        }
    }

    public static SyncLimits unlimited() {
        return new SyncLimits(0, 0, 0);
    }

    /**
     * Cap for the given page kind, or 0 when the kind is not capped.
     */
    public int limitFor(PageKind pageKind) {
        return switch (pageKind) {
            case EVENT_OVERVIEW -> maxEvents;
            case TEAM_ROSTER -> maxTeams;
            case PLAYER_PROFILE -> maxPlayers;
            default -> 0;
        };
    }
}
