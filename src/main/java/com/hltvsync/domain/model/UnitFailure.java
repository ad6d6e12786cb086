package com.hltvsync.domain.model;

import java.time.Instant;
import java.util.List;

public record UnitFailure(
        String unitKey,
        PageKind pageKind,
        String url,
        FailureType type,
        int attempts,
        List<String> lastSignals,
        String message,
        Instant failedAt) {

    public UnitFailure {
        lastSignals = lastSignals == null ? List.of() : List.copyOf(lastSignals);
    }
}
