package com.hltvsync.application.usecase;

import com.hltvsync.domain.exception.PersistenceException;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.ReconcileReport;
import com.hltvsync.domain.ports.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays stored extraction snapshots into the reconciler without fetching anything.
 */
@Service
public class SnapshotReplayUseCase {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotReplayUseCase.class);

    private final SnapshotStore snapshotStore;
    private final Reconciler reconciler;

    public SnapshotReplayUseCase(SnapshotStore snapshotStore, Reconciler reconciler) {
        this.snapshotStore = snapshotStore;
        this.reconciler = reconciler;
    }

    /**
     * Reconciles every snapshot under the directory, parents before children. A constraint
     * violation skips that snapshot; an unreachable store aborts the replay.
     */
    public ReplaySummary replay(Path directory) throws IOException {
        List<Extraction> snapshots = snapshotStore.loadAll(directory);
        logger.info("Replaying {} snapshots from {}", snapshots.size(), directory);

        ReconcileReport upserts = ReconcileReport.empty();
        Map<String, String> errors = new LinkedHashMap<>();
        int replayed = 0;
        for (Extraction snapshot : snapshots) {
            String name = snapshot.pageKind() + ":" + snapshot.subjectId();
            try {
                upserts = upserts.plus(reconciler.reconcile(snapshot));
                replayed++;
            } catch (PersistenceException e) {
                if (e.isConnectivity()) {
                    throw e;
                }
                logger.warn("Snapshot {} rejected: {}", name, e.getMessage());
                errors.put(name, e.getMessage());
            }
        }
        logger.info("Replay finished: {} applied, {} rejected", replayed, errors.size());
        return new ReplaySummary(replayed, upserts, errors);
    }

    public record ReplaySummary(int replayed, ReconcileReport upserts, Map<String, String> errors) {
    }
}
