package com.hltvsync.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Persisted progress of a run: the planned units in plan order, those that committed, and
 * the failures recorded so far. An open checkpoint is resumed by the next run with the same key.
 */
public record SyncCheckpoint(
        String scopeKey,
        ScopeDirective scope,
        SyncLimits limits,
        List<UnitOfWork> planned,
        Set<String> completed,
        List<UnitFailure> failures,
        boolean open,
        RunState finalState,
        Instant openedAt,
        Instant updatedAt) {

    public SyncCheckpoint {
        planned = planned == null ? List.of() : List.copyOf(planned);
        completed = completed == null ? Set.of() : Set.copyOf(completed);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public List<UnitOfWork> pending() {
        return planned.stream().filter(unit -> !completed.contains(unit.key())).toList();
    }
}
