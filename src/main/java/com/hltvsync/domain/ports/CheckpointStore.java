package com.hltvsync.domain.ports;

import com.hltvsync.domain.model.RunState;
import com.hltvsync.domain.model.ScopeDirective;
import com.hltvsync.domain.model.SyncCheckpoint;
import com.hltvsync.domain.model.SyncLimits;
import com.hltvsync.domain.model.UnitFailure;
import com.hltvsync.domain.model.UnitOfWork;

import java.util.List;
import java.util.Optional;

/**
 * Port for run checkpoints. Writes happen strictly after the unit's transaction committed.
 */
public interface CheckpointStore {

    Optional<SyncCheckpoint> findOpen(String scopeKey);

    /**
     * Most recent checkpoint for the key, open or closed.
     */
    Optional<SyncCheckpoint> findLatest(String scopeKey);

    SyncCheckpoint open(String scopeKey, ScopeDirective scope, SyncLimits limits, List<UnitOfWork> roots);

    /**
     * Marks the unit completed, clears its earlier failures and appends its children to the plan.
     */
    void markCompleted(String scopeKey, UnitOfWork unit, List<UnitOfWork> children);

    void markFailed(String scopeKey, UnitFailure failure);

    void close(String scopeKey, RunState finalState);
}
