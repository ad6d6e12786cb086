package com.hltvsync.infrastructure.rest;

import com.hltvsync.application.usecase.SnapshotReplayUseCase;
import com.hltvsync.application.usecase.SyncOrchestrator;
import com.hltvsync.domain.model.SyncSummary;
import com.hltvsync.infrastructure.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Paths;
import java.util.Map;

/**
 * REST controller for sync runs.
 */
@RestController
@RequestMapping("/sync")
public class SyncController {

    private static final Logger logger = LoggerFactory.getLogger(SyncController.class);

    private final SyncOrchestrator syncOrchestrator;
    private final SnapshotReplayUseCase snapshotReplayUseCase;
    private final ScraperProperties properties;

    public SyncController(SyncOrchestrator syncOrchestrator,
                          SnapshotReplayUseCase snapshotReplayUseCase,
                          ScraperProperties properties) {
        this.syncOrchestrator = syncOrchestrator;
        this.snapshotReplayUseCase = snapshotReplayUseCase;
        this.properties = properties;
    }

    /**
     * Runs a sync for the given scope and waits for it to finish.
     *
     * POST /sync
     *
     * @return Summary of the run
     */
    @PostMapping
    public ResponseEntity<SyncSummary> sync(@RequestBody SyncRequest request) {
        if (request == null || request.scope() == null) {
            return ResponseEntity.badRequest().build();
        }
        logger.info("Received sync request for {}", request.scope().key());

        try {
            SyncSummary summary = syncOrchestrator.execute(request.scope(), request.limitsOrUnlimited());
            logger.info("Sync {} finished {}", summary.scopeKey(), summary.state());
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            logger.error("Error running sync", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * POST /sync/cancel
     */
    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Integer>> cancel() {
        int cancelled = syncOrchestrator.cancelActiveRuns();
        logger.info("Cancellation requested for {} active runs", cancelled);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    /**
     * Re-runs the failed units of the latest checkpoint of a scope.
     *
     * POST /sync/retry-failed?scopeKey=EVENT:id=8040:full
     */
    @PostMapping("/retry-failed")
    public ResponseEntity<SyncSummary> retryFailed(@RequestParam String scopeKey) {
        logger.info("Received retry request for {}", scopeKey);

        try {
            return ResponseEntity.ok(syncOrchestrator.retryFailed(scopeKey));
        } catch (IllegalArgumentException e) {
            logger.warn("Cannot retry {}: {}", scopeKey, e.getMessage());
            return ResponseEntity.notFound().build();
        } catch (Exception e) {
            logger.error("Error retrying failed units of {}", scopeKey, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Replays snapshots from a directory, by default the configured snapshot directory.
     *
     * POST /sync/replay?directory=snapshots
     */
    @PostMapping("/replay")
    public ResponseEntity<SnapshotReplayUseCase.ReplaySummary> replay(
            @RequestParam(required = false) String directory) {
        String target = directory != null ? directory : properties.getSnapshots().getDirectory();
        logger.info("Received replay request for {}", target);

        try {
            return ResponseEntity.ok(snapshotReplayUseCase.replay(Paths.get(target)));
        } catch (Exception e) {
            logger.error("Error replaying snapshots from {}", target, e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
