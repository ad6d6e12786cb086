package com.hltvsync.domain.model;

import java.util.List;

/**
 * Outcome of one sync run.
 */
public record SyncSummary(
        String scopeKey,
        RunState state,
        List<RunState> transitions,
        boolean resumed,
        boolean cancelled,
        int completedUnits,
        int skippedUnits,
        ReconcileReport upserts,
        List<UnitFailure> failures,
        String failureReason) {
}
