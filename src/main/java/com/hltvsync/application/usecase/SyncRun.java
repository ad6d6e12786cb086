package com.hltvsync.application.usecase;

import com.hltvsync.domain.model.ReconcileReport;
import com.hltvsync.domain.model.RunState;
import com.hltvsync.domain.model.SyncSummary;
import com.hltvsync.domain.model.UnitFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one run, shared by its workers.
 */
final class SyncRun {

    private static final Logger logger = LoggerFactory.getLogger(SyncRun.class);

    private final String scopeKey;
    private final List<RunState> transitions = new ArrayList<>();
    private final List<UnitFailure> failures = new ArrayList<>();
    private RunState state;
    private boolean resumed;
    private boolean cancelled;
    private int completedUnits;
    private int skippedUnits;
    private ReconcileReport upserts = ReconcileReport.empty();
    private volatile String failureReason;

    SyncRun(String scopeKey) {
        this.scopeKey = scopeKey;
    }

    String scopeKey() {
        return scopeKey;
    }

    synchronized void transition(RunState next) {
        if (state != null && state.isTerminal()) {
            return;
        }
        logger.debug("Run {}: {} -> {}", scopeKey, state, next);
        state = next;
        transitions.add(next);
    }

    synchronized RunState state() {
        return state;
    }

    void fail(String reason) {
        synchronized (this) {
            if (failureReason == null) {
                failureReason = reason;
            }
        }
    }

    boolean isFailed() {
        return failureReason != null;
    }

    synchronized void markResumed(int alreadyCompleted) {
        this.resumed = true;
        this.skippedUnits = alreadyCompleted;
    }

    synchronized void markCancelled() {
        this.cancelled = true;
    }

    synchronized void recordCompleted(ReconcileReport report) {
        completedUnits++;
        upserts = upserts.plus(report);
    }

    synchronized void recordFailure(UnitFailure failure) {
        failures.add(failure);
    }

    synchronized SyncSummary toSummary() {
        return new SyncSummary(
            scopeKey,
            state,
            List.copyOf(transitions),
            resumed,
            cancelled,
            completedUnits,
            skippedUnits,
            upserts,
            List.copyOf(failures),
            failureReason);
    }
}
