package com.hltvsync.application.usecase;

import com.hltvsync.domain.exception.BlockedPageException;
import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.exception.FetchException;
import com.hltvsync.domain.exception.PersistenceException;
import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.FailureType;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.ReconcileReport;
import com.hltvsync.domain.model.RunState;
import com.hltvsync.domain.model.ScopeDirective;
import com.hltvsync.domain.model.SyncCheckpoint;
import com.hltvsync.domain.model.SyncLimits;
import com.hltvsync.domain.model.SyncSummary;
import com.hltvsync.domain.model.UnitFailure;
import com.hltvsync.domain.model.UnitOfWork;
import com.hltvsync.domain.ports.CheckpointStore;
import com.hltvsync.domain.ports.PageExtractor;
import com.hltvsync.domain.ports.PageSource;
import com.hltvsync.domain.ports.SnapshotStore;
import com.hltvsync.infrastructure.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Drives a sync run: plan, then fetch, extract, reconcile and checkpoint each unit.
 *
 * Units run in dependency waves, lowest level first, on a worker pool per entity kind. Unit
 * failures are recorded and never abort the run; only an unreachable store or a failed listing
 * fetch while planning fails it. A run with the same scope key resumes an open checkpoint.
 * One run executes at a time, since runs share the session pool.
 */
@Service
public class SyncOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final PageSource pageSource;
    private final PageExtractor extractor;
    private final Reconciler reconciler;
    private final CheckpointStore checkpointStore;
    private final SnapshotStore snapshotStore;
    private final SyncPlanner planner;
    private final ScraperProperties.Workers workers;
    private final Clock clock;
    private final Set<CancellationSignal> activeSignals = ConcurrentHashMap.newKeySet();
    private final Object runLock = new Object();

    public SyncOrchestrator(
            PageSource pageSource,
            PageExtractor extractor,
            Reconciler reconciler,
            CheckpointStore checkpointStore,
            SnapshotStore snapshotStore,
            SyncPlanner planner,
            ScraperProperties properties,
            Clock clock) {
        this.pageSource = pageSource;
        this.extractor = extractor;
        this.reconciler = reconciler;
        this.checkpointStore = checkpointStore;
        this.snapshotStore = snapshotStore;
        this.planner = planner;
        this.workers = properties.getWorkers();
        this.clock = clock;
    }

    public SyncSummary execute(ScopeDirective scope, SyncLimits limits) {
        return execute(scope, limits, new CancellationSignal());
    }

    public SyncSummary execute(ScopeDirective scope, SyncLimits limits, CancellationSignal signal) {
        return run(scope.key(), scope, limits, signal, null);
    }

    /**
     * Re-runs exactly the units that failed in the most recent checkpoint of the scope key,
     * under the key {@code <scopeKey>:retry}. Units a later retry already completed are skipped.
     */
    public SyncSummary retryFailed(String scopeKey) {
        SyncCheckpoint latest = checkpointStore.findLatest(scopeKey)
            .orElseThrow(() -> new IllegalArgumentException("No checkpoint for scope " + scopeKey));
        Set<String> fixed = checkpointStore.findLatest(scopeKey + ":retry")
            .filter(retry -> !retry.openedAt().isBefore(latest.openedAt()))
            .map(SyncCheckpoint::completed)
            .orElse(Set.of());
        List<UnitOfWork> failed = latest.failures().stream()
            .map(failure -> UnitOfWork.parse(failure.unitKey()))
            .filter(unit -> !latest.completed().contains(unit.key()))
            .filter(unit -> !fixed.contains(unit.key()))
            .distinct()
            .toList();
        logger.info("Retrying {} failed units of {}", failed.size(), scopeKey);
        return run(scopeKey + ":retry", latest.scope(), latest.limits(), new CancellationSignal(), failed);
    }

    /**
     * Signals every active run to stop starting units.
     *
     * @return the number of runs signalled
     */
    public int cancelActiveRuns() {
        activeSignals.forEach(CancellationSignal::cancel);
        return activeSignals.size();
    }

    private SyncSummary run(String scopeKey, ScopeDirective scope, SyncLimits limits,
                            CancellationSignal signal, List<UnitOfWork> explicitRoots) {
        synchronized (runLock) {
            SyncRun run = new SyncRun(scopeKey);
            activeSignals.add(signal);
            run.transition(RunState.PLANNING);
            logger.info("Starting sync run {}", scopeKey);
            try {
                RunPlan plan = openPlan(run, scope, limits, explicitRoots);
                if (plan != null) {
                    executeWaves(run, plan, scope, signal);
                }
            } catch (PersistenceException e) {
                logger.error("Store failure in run {}", scopeKey, e);
                run.fail("Store unreachable: " + e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Unexpected error in run {}", scopeKey, e);
                run.fail("Unexpected error: " + e);
            } finally {
                activeSignals.remove(signal);
                pageSource.shutdown();
            }
            return finish(run, signal);
        }
    }

    private RunPlan openPlan(SyncRun run, ScopeDirective scope, SyncLimits limits, List<UnitOfWork> explicitRoots) {
        Optional<SyncCheckpoint> open = checkpointStore.findOpen(run.scopeKey());
        if (open.isPresent()) {
            RunPlan plan = RunPlan.resume(open.get(), limits);
            run.markResumed(plan.completedCount());
            logger.info("Resuming run {} with {} units already completed", run.scopeKey(), plan.completedCount());
            return plan;
        }

        List<UnitOfWork> roots = explicitRoots;
        if (roots == null) {
            try {
                roots = planner.planRoots(scope, limits);
            } catch (FetchException | ExtractionException e) {
                logger.error("Planning failed for run {}: {}", run.scopeKey(), e.getMessage());
                run.fail("Planning failed: " + e.getMessage());
                return null;
            }
        }
        RunPlan plan = new RunPlan(limits);
        List<UnitOfWork> admitted = plan.admit(roots);
        checkpointStore.open(run.scopeKey(), scope, limits, admitted);
        logger.info("Planned {} root units for run {}", admitted.size(), run.scopeKey());
        return plan;
    }

    private void executeWaves(SyncRun run, RunPlan plan, ScopeDirective scope, CancellationSignal signal) {
        Map<EntityKind, ExecutorService> executors = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            executors.put(kind, Executors.newFixedThreadPool(workers.sizeFor(kind)));
        }
        try {
            while (!signal.isCancelled() && !run.isFailed()) {
                List<UnitOfWork> wave;
                synchronized (plan) {
                    wave = plan.nextWave();
                }
                if (wave.isEmpty()) {
                    break;
                }
                List<CompletableFuture<Void>> futures = wave.stream()
                    .map(unit -> CompletableFuture.runAsync(
                            () -> executeUnit(run, plan, unit, scope, signal),
                            executors.get(unit.pageKind().getEntityKind()))
                        .exceptionally(e -> {
                            logger.error("Unit {} ended with an unexpected error", unit.key(), e);
                            recordFailure(run, plan, unit, null, FailureType.PERSISTENCE, 1, List.of(), e.toString());
                            return null;
                        }))
                    .toList();
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            }
        } finally {
            executors.values().forEach(ExecutorService::shutdown);
        }
    }

    private void executeUnit(SyncRun run, RunPlan plan, UnitOfWork unit, ScopeDirective scope,
                             CancellationSignal signal) {
        if (signal.isCancelled() || run.isFailed()) {
            logger.debug("Not starting {}: run is stopping", unit.key());
            return;
        }
        String url = pageSource.urlFor(unit.pageKind(), unit.externalId());

        run.transition(RunState.FETCHING);
        PageContent page;
        try {
            page = pageSource.fetch(unit.pageKind(), unit.externalId());
        } catch (FetchException e) {
            FailureType type = e instanceof BlockedPageException ? FailureType.BLOCKED : FailureType.TRANSIENT;
            recordFailure(run, plan, unit, url, type, e.getAttempts(), e.getSignals(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            logger.error("Unexpected error fetching {}", url, e);
            recordFailure(run, plan, unit, url, FailureType.TRANSIENT, 1, List.of(), e.toString());
            return;
        }

        Extraction extraction;
        try {
            extraction = extractor.extract(page);
        } catch (ExtractionException e) {
            recordFailure(run, plan, unit, url, FailureType.EXTRACTION, 1, List.of(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            logger.error("Unexpected error extracting {}", url, e);
            recordFailure(run, plan, unit, url, FailureType.EXTRACTION, 1, List.of(), e.toString());
            return;
        }

        run.transition(RunState.RECONCILING);
        ReconcileReport report;
        try {
            report = reconciler.reconcile(extraction);
        } catch (PersistenceException e) {
            if (e.isConnectivity()) {
                logger.error("Store unreachable while reconciling {}", unit.key(), e);
                run.fail("Store unreachable: " + e.getMessage());
                return;
            }
            recordFailure(run, plan, unit, url, FailureType.PERSISTENCE, 1, List.of(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            logger.error("Unexpected error reconciling {}", unit.key(), e);
            recordFailure(run, plan, unit, url, FailureType.PERSISTENCE, 1, List.of(), e.toString());
            return;
        }

        List<UnitOfWork> children;
        try {
            snapshotStore.emit(unit, extraction);
            children = planner.childrenOf(unit, extraction, scope);
        } catch (RuntimeException e) {
            logger.error("Unexpected error after reconciling {}", unit.key(), e);
            recordFailure(run, plan, unit, url, FailureType.PERSISTENCE, 1, List.of(), e.toString());
            return;
        }
        synchronized (plan) {
            List<UnitOfWork> admitted = plan.admit(children);
            try {
                checkpointStore.markCompleted(run.scopeKey(), unit, admitted);
            } catch (PersistenceException e) {
                logger.error("Failed to checkpoint {}", unit.key(), e);
                run.fail("Checkpoint write failed: " + e.getMessage());
                return;
            }
            plan.complete(unit);
            run.recordCompleted(report);
            run.transition(RunState.CHECKPOINTED);
            logger.info("Completed {} ({} inserted, {} updated, {} unchanged; {} children planned)",
                unit.key(), report.inserted(), report.updated(), report.unchanged(), admitted.size());
        }
    }

    private void recordFailure(SyncRun run, RunPlan plan, UnitOfWork unit, String url, FailureType type,
                               int attempts, List<String> signals, String message) {
        UnitFailure failure = new UnitFailure(
            unit.key(), unit.pageKind(), url, type, attempts, signals, message, clock.instant());
        logger.warn("Unit {} failed ({} after {} attempts): {}", unit.key(), type, attempts, message);
        synchronized (plan) {
            run.recordFailure(failure);
            try {
                checkpointStore.markFailed(run.scopeKey(), failure);
            } catch (PersistenceException e) {
                logger.error("Failed to record failure of {}", unit.key(), e);
                run.fail("Checkpoint write failed: " + e.getMessage());
            }
        }
    }

    private SyncSummary finish(SyncRun run, CancellationSignal signal) {
        if (signal.isCancelled()) {
            run.markCancelled();
            run.fail("Cancelled");
        }
        if (!run.isFailed()) {
            try {
                checkpointStore.close(run.scopeKey(), RunState.DONE);
            } catch (PersistenceException e) {
                logger.error("Failed to close checkpoint of {}", run.scopeKey(), e);
                run.fail("Checkpoint close failed: " + e.getMessage());
            }
        }
        run.transition(run.isFailed() ? RunState.FAILED : RunState.DONE);

        SyncSummary summary = run.toSummary();
        logger.info("Run {} finished {}: {} units completed, {} skipped, {} failed{}",
            summary.scopeKey(), summary.state(), summary.completedUnits(), summary.skippedUnits(),
            summary.failures().size(), summary.failureReason() == null ? "" : " (" + summary.failureReason() + ")");
        return summary;
    }
}
