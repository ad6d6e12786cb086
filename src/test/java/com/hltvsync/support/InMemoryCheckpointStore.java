package com.hltvsync.support;

import com.hltvsync.domain.exception.PersistenceException;
import com.hltvsync.domain.model.RunState;
import com.hltvsync.domain.model.ScopeDirective;
import com.hltvsync.domain.model.SyncCheckpoint;
import com.hltvsync.domain.model.SyncLimits;
import com.hltvsync.domain.model.UnitFailure;
import com.hltvsync.domain.model.UnitOfWork;
import com.hltvsync.domain.ports.CheckpointStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checkpoint store kept in memory, newest checkpoint last.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final List<Entry> entries = new ArrayList<>();
    private int completionsBeforeOutage = -1;

    @Override
    public synchronized Optional<SyncCheckpoint> findOpen(String scopeKey) {
        return openEntry(scopeKey).map(Entry::toCheckpoint);
    }

    @Override
    public synchronized Optional<SyncCheckpoint> findLatest(String scopeKey) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).scopeKey.equals(scopeKey)) {
                return Optional.of(entries.get(i).toCheckpoint());
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized SyncCheckpoint open(String scopeKey, ScopeDirective scope, SyncLimits limits,
                                            List<UnitOfWork> roots) {
        Entry entry = new Entry(scopeKey, scope, limits);
        entry.planned.addAll(roots);
        entries.add(entry);
        return entry.toCheckpoint();
    }

    @Override
    public synchronized void markCompleted(String scopeKey, UnitOfWork unit, List<UnitOfWork> children) {
        if (completionsBeforeOutage == 0) {
            throw new PersistenceException(PersistenceException.Kind.CONNECTIVITY, "checkpoint store offline");
        }
        if (completionsBeforeOutage > 0) {
            completionsBeforeOutage--;
        }
        Entry entry = requireOpen(scopeKey);
        entry.completed.add(unit.key());
        entry.failures.removeIf(failure -> failure.unitKey().equals(unit.key()));
        entry.planned.addAll(children);
    }

    @Override
    public synchronized void markFailed(String scopeKey, UnitFailure failure) {
        requireOpen(scopeKey).failures.add(failure);
    }

    @Override
    public synchronized void close(String scopeKey, RunState finalState) {
        Entry entry = requireOpen(scopeKey);
        entry.open = false;
        entry.finalState = finalState;
    }

    /**
     * Lets the given number of completions through, then fails every later one as unreachable.
     */
    public synchronized void goOfflineAfter(int completions) {
        this.completionsBeforeOutage = completions;
    }

    public synchronized void comeBackOnline() {
        this.completionsBeforeOutage = -1;
    }

    public synchronized int checkpointCount() {
        return entries.size();
    }

    private Optional<Entry> openEntry(String scopeKey) {
        return entries.stream().filter(entry -> entry.open && entry.scopeKey.equals(scopeKey)).findFirst();
    }

    private Entry requireOpen(String scopeKey) {
        return openEntry(scopeKey)
            .orElseThrow(() -> PersistenceException.constraint("No open checkpoint for " + scopeKey));
    }

    private static class Entry {
        private final String scopeKey;
        private final ScopeDirective scope;
        private final SyncLimits limits;
        private final List<UnitOfWork> planned = new ArrayList<>();
        private final Set<String> completed = new LinkedHashSet<>();
        private final List<UnitFailure> failures = new ArrayList<>();
        private final Instant openedAt = Instant.parse("2024-03-01T10:00:00Z");
        private boolean open = true;
        private RunState finalState;

        Entry(String scopeKey, ScopeDirective scope, SyncLimits limits) {
            this.scopeKey = scopeKey;
            this.scope = scope;
            this.limits = limits;
        }

        SyncCheckpoint toCheckpoint() {
            return new SyncCheckpoint(scopeKey, scope, limits, planned, completed, failures, open, finalState,
                openedAt, openedAt);
        }
    }
}
