package com.hltvsync.domain.model;

import java.time.Instant;

/**
 * Career aggregate statistics shown on a player profile.
 */
public record PlayerStats(
        Integer kills,
        Integer deaths,
        Double kdRatio,
        Double rating,
        Double kast,
        Double adr,
        Double kpr,
        Double impact,
        Double headshotPercentage,
        Integer mapsPlayed,
        Integer roundsPlayed,
        Instant capturedAt) {

    public boolean hasAnyValue() {
        return kills != null || deaths != null || kdRatio != null || rating != null || kast != null
            || adr != null || kpr != null || impact != null || headshotPercentage != null
            || mapsPlayed != null || roundsPlayed != null;
    }
}
