package com.hltvsync.infrastructure.persistence;

import com.hltvsync.domain.exception.PersistenceException;
import com.hltvsync.domain.model.FailureType;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.RunState;
import com.hltvsync.domain.model.ScopeDirective;
import com.hltvsync.domain.model.SyncCheckpoint;
import com.hltvsync.domain.model.SyncLimits;
import com.hltvsync.domain.model.UnitFailure;
import com.hltvsync.domain.model.UnitOfWork;
import com.hltvsync.domain.ports.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Checkpoints in the {@code sync_checkpoints} collection, one document per run.
 */
@Repository
public class MongoCheckpointStore implements CheckpointStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoCheckpointStore.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoCheckpointStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            mongoTemplate.indexOps(CheckpointDocument.class)
                .ensureIndex(new Index().on("scopeKey", Sort.Direction.ASC).on("openedAt", Sort.Direction.DESC));
        } catch (DataAccessException e) {
            logger.warn("Failed to create checkpoint index (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public Optional<SyncCheckpoint> findOpen(String scopeKey) {
        return guarded(() -> Optional.ofNullable(mongoTemplate.findOne(openQuery(scopeKey), CheckpointDocument.class))
            .map(MongoCheckpointStore::toCheckpoint));
    }

    @Override
    public Optional<SyncCheckpoint> findLatest(String scopeKey) {
        Query query = Query.query(Criteria.where("scopeKey").is(scopeKey))
            .with(Sort.by(Sort.Direction.DESC, "openedAt"))
            .limit(1);
        return guarded(() -> Optional.ofNullable(mongoTemplate.findOne(query, CheckpointDocument.class))
            .map(MongoCheckpointStore::toCheckpoint));
    }

    @Override
    public SyncCheckpoint open(String scopeKey, ScopeDirective scope, SyncLimits limits, List<UnitOfWork> roots) {
        Instant now = clock.instant();
        CheckpointDocument document = new CheckpointDocument();
        document.setScopeKey(scopeKey);
        document.setKind(scope.kind());
        document.setSpecificId(scope.specificId());
        document.setUnseenCount(scope.unseenCount());
        document.setFullStats(scope.fullStats());
        document.setMaxEvents(limits.maxEvents());
        document.setMaxTeams(limits.maxTeams());
        document.setMaxPlayers(limits.maxPlayers());
        document.setPlanned(new ArrayList<>(roots.stream().map(UnitOfWork::key).toList()));
        document.setOpen(true);
        document.setOpenedAt(now);
        document.setUpdatedAt(now);
        return guarded(() -> toCheckpoint(mongoTemplate.insert(document)));
    }

    @Override
    public void markCompleted(String scopeKey, UnitOfWork unit, List<UnitOfWork> children) {
        Update update = new Update()
            .addToSet("completed", unit.key())
            .pull("failures", new org.bson.Document("unitKey", unit.key()))
            .set("updatedAt", clock.instant());
        if (!children.isEmpty()) {
            update.push("planned").each(children.stream().map(UnitOfWork::key).toArray());
        }
        guarded(() -> mongoTemplate.updateFirst(openQuery(scopeKey), update, CheckpointDocument.class));
    }

    @Override
    public void markFailed(String scopeKey, UnitFailure failure) {
        Update update = new Update()
            .push("failures", toEntry(failure))
            .set("updatedAt", clock.instant());
        guarded(() -> mongoTemplate.updateFirst(openQuery(scopeKey), update, CheckpointDocument.class));
    }

    @Override
    public void close(String scopeKey, RunState finalState) {
        Update update = new Update()
            .set("open", false)
            .set("finalState", finalState.name())
            .set("updatedAt", clock.instant());
        guarded(() -> mongoTemplate.updateFirst(openQuery(scopeKey), update, CheckpointDocument.class));
    }

    private static Query openQuery(String scopeKey) {
        return Query.query(Criteria.where("scopeKey").is(scopeKey).and("open").is(true));
    }

    private static <T> T guarded(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new PersistenceException(PersistenceException.Kind.CONNECTIVITY, e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new PersistenceException(PersistenceException.Kind.CONSTRAINT, e.getMessage(), e);
        }
    }

    private static CheckpointDocument.FailureEntry toEntry(UnitFailure failure) {
        CheckpointDocument.FailureEntry entry = new CheckpointDocument.FailureEntry();
        entry.setUnitKey(failure.unitKey());
        entry.setPageKind(failure.pageKind().name());
        entry.setUrl(failure.url());
        entry.setType(failure.type().name());
        entry.setAttempts(failure.attempts());
        entry.setLastSignals(new ArrayList<>(failure.lastSignals()));
        entry.setMessage(failure.message());
        entry.setFailedAt(failure.failedAt());
        return entry;
    }

    private static SyncCheckpoint toCheckpoint(CheckpointDocument document) {
        ScopeDirective scope = new ScopeDirective(
            document.getKind(), document.getSpecificId(), document.getUnseenCount(), document.isFullStats());
        SyncLimits limits = new SyncLimits(document.getMaxEvents(), document.getMaxTeams(), document.getMaxPlayers());
        List<UnitFailure> failures = document.getFailures().stream()
            .map(entry -> new UnitFailure(
                entry.getUnitKey(),
                PageKind.valueOf(entry.getPageKind()),
                entry.getUrl(),
                FailureType.valueOf(entry.getType()),
                entry.getAttempts(),
                entry.getLastSignals(),
                entry.getMessage(),
                entry.getFailedAt()))
            .toList();
        return new SyncCheckpoint(
            document.getScopeKey(),
            scope,
            limits,
            document.getPlanned().stream().map(UnitOfWork::parse).toList(),
            new HashSet<>(document.getCompleted()),
            failures,
            document.isOpen(),
            document.getFinalState() == null ? null : RunState.valueOf(document.getFinalState()),
            document.getOpenedAt(),
            document.getUpdatedAt());
    }
}
