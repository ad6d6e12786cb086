package com.hltvsync.infrastructure.rest;

import com.hltvsync.application.usecase.Reconciler;
import com.hltvsync.application.usecase.SnapshotReplayUseCase;
import com.hltvsync.application.usecase.SyncOrchestrator;
import com.hltvsync.application.usecase.SyncPlanner;
import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.EventRecord;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.RunState;
import com.hltvsync.domain.model.ScopeDirective;
import com.hltvsync.domain.model.SyncSummary;
import com.hltvsync.infrastructure.config.ScraperProperties;
import com.hltvsync.infrastructure.snapshot.JsonSnapshotStore;
import com.hltvsync.support.InMemoryCheckpointStore;
import com.hltvsync.support.InMemoryRecordStore;
import com.hltvsync.support.MutableClock;
import com.hltvsync.support.ScriptedSite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncControllerTest {

    @TempDir
    Path directory;

    private ScriptedSite site;
    private SyncController controller;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        InMemoryRecordStore store = new InMemoryRecordStore();
        Reconciler reconciler = new Reconciler(store, clock);
        JsonSnapshotStore snapshots = new JsonSnapshotStore(true, directory);
        ScraperProperties properties = new ScraperProperties();
        properties.getSnapshots().setDirectory(directory.toString());
        site = new ScriptedSite();
        SyncOrchestrator orchestrator = new SyncOrchestrator(site, site, reconciler, new InMemoryCheckpointStore(),
            snapshots, new SyncPlanner(site, site, store), properties, clock);
        controller = new SyncController(orchestrator, new SnapshotReplayUseCase(snapshots, reconciler), properties);
    }

    @Test
    void testSyncReturnsSummary() {
        site.page(PageKind.EVENT_OVERVIEW, 8040L, List.of(EventRecord.stub(8040L, "PGL Major Antwerp 2022")), List.of());

        ResponseEntity<SyncSummary> response = controller.sync(
            new SyncRequest(ScopeDirective.specific(EntityKind.EVENT, 8040L, false), null));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(RunState.DONE, response.getBody().state());
        assertEquals("EVENT:id=8040:basic", response.getBody().scopeKey());
    }

    @Test
    void testSyncWithoutScopeIsBadRequest() {
        ResponseEntity<SyncSummary> response = controller.sync(new SyncRequest(null, null));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void testRetryOfUnknownScopeIsNotFound() {
        ResponseEntity<SyncSummary> response = controller.retryFailed("TEAM:unseen=5:basic");

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    void testCancelWithoutActiveRuns() {
        ResponseEntity<Map<String, Integer>> response = controller.cancel();

        assertEquals(Map.of("cancelled", 0), response.getBody());
    }

    @Test
    void testReplayDefaultsToSnapshotDirectory() {
        site.page(PageKind.EVENT_OVERVIEW, 8040L, List.of(EventRecord.stub(8040L, "PGL Major Antwerp 2022")), List.of());
        controller.sync(new SyncRequest(ScopeDirective.specific(EntityKind.EVENT, 8040L, false), null));

        ResponseEntity<SnapshotReplayUseCase.ReplaySummary> response = controller.replay(null);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(1, response.getBody().replayed());
    }

    @Test
    void testReplayOfMissingDirectoryFails() {
        ResponseEntity<SnapshotReplayUseCase.ReplaySummary> response =
            controller.replay(directory.resolve("missing").toString());

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
    }
}
