package com.hltvsync.application.usecase;

import com.hltvsync.domain.exception.PersistenceException;
import com.hltvsync.domain.model.AssociationKind;
import com.hltvsync.domain.model.AssociationRecord;
import com.hltvsync.domain.model.EventRecord;
import com.hltvsync.domain.model.EventStatRecord;
import com.hltvsync.domain.model.ExtractedRecord;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PlayerRecord;
import com.hltvsync.domain.model.ReconcileReport;
import com.hltvsync.domain.model.TeamRecord;
import com.hltvsync.domain.model.UpsertOutcome;
import com.hltvsync.domain.ports.RecordStore;
import com.hltvsync.domain.ports.StoreCollection;
import com.hltvsync.domain.ports.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Upserts extracted records by external id.
 *
 * All records of one unit are applied in one transaction. Missing team and player parents are
 * created as stubs in that transaction; a missing event parent is a constraint violation.
 * Stored values never regress to null.
 */
@Service
public class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private final RecordStore recordStore;
    private final Clock clock;

    public Reconciler(RecordStore recordStore, Clock clock) {
        this.recordStore = recordStore;
        this.clock = clock;
    }

    /**
     * Applies every record of the extraction atomically. Listing pages are planning input only
     * and are not reconciled.
     */
    public ReconcileReport reconcile(Extraction extraction) {
        if (extraction.pageKind().isListing()) {
            return ReconcileReport.empty();
        }
        ReconcileReport report = recordStore.inTransaction(tx -> {
            ReconcileReport outcomes = ReconcileReport.empty();
            for (ExtractedRecord record : extraction.records()) {
                outcomes = outcomes.plus(apply(tx, record));
            }
            return outcomes;
        });
        logger.debug("Reconciled {} {}: {}", extraction.pageKind(), extraction.subjectId(), report);
        return report;
    }

    public UpsertOutcome upsert(ExtractedRecord record) {
        return recordStore.inTransaction(tx -> apply(tx, record));
    }

    /**
     * Upserts an association. Roster entries are dated today (UTC). An association refreshed in
     * place reports UPDATED even when no attribute changed.
     */
    public UpsertOutcome upsertAssociation(AssociationKind kind, long leftId, long rightId,
                                           Map<String, Object> attributes) {
        AssociationRecord record = kind == AssociationKind.TEAM_PLAYER
            ? AssociationRecord.teamPlayer(leftId, rightId, clock.instant().atOffset(ZoneOffset.UTC).toLocalDate(),
                attributes)
            : AssociationRecord.eventTeam(leftId, rightId, attributes);
        UpsertOutcome outcome = upsert(record);
        return outcome == UpsertOutcome.INSERTED ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
    }

    private UpsertOutcome apply(StoreTransaction tx, ExtractedRecord record) {
        if (record instanceof EventStatRecord stat) {
            requireEvent(tx, stat.eventId());
            ensureParent(tx, StoreCollection.PLAYERS, stat.playerId(), "nickname", stat.nickname());
        } else if (record instanceof AssociationRecord association) {
            if (association.kind() == AssociationKind.EVENT_TEAM) {
                requireEvent(tx, association.leftId());
                ensureParent(tx, StoreCollection.TEAMS, association.rightId(), "name", null);
            } else {
                ensureParent(tx, StoreCollection.TEAMS, association.leftId(), "name", null);
                ensureParent(tx, StoreCollection.PLAYERS, association.rightId(), "nickname",
                    association.attributes().get("nickname"));
            }
        }
        return upsertRow(tx, collectionOf(record), record.key(), record.fields());
    }

    private UpsertOutcome upsertRow(StoreTransaction tx, StoreCollection collection,
                                    Map<String, Object> key, Map<String, Object> fields) {
        Instant now = clock.instant();
        Optional<Map<String, Object>> existing = tx.findOne(collection, key);
        if (existing.isEmpty()) {
            Map<String, Object> row = new LinkedHashMap<>(key);
            row.putAll(fields);
            row.put("createdAt", now);
            row.put("updatedAt", now);
            tx.insert(collection, row);
            return UpsertOutcome.INSERTED;
        }

        FieldMerger.MergeResult merged = FieldMerger.merge(existing.get(), fields);
        if (!merged.changed()) {
            return UpsertOutcome.UNCHANGED;
        }
        Map<String, Object> row = merged.row();
        row.put("updatedAt", now);
        tx.replace(collection, key, row);
        return UpsertOutcome.UPDATED;
    }

    private void requireEvent(StoreTransaction tx, long eventId) {
        if (tx.findOne(StoreCollection.EVENTS, Map.of("eventId", eventId)).isEmpty()) {
            throw PersistenceException.constraint("Event " + eventId + " does not exist");
        }
    }

    /**
     * Inserts a stub row for a missing team or player, carrying the label seen on the page.
     */
    private void ensureParent(StoreTransaction tx, StoreCollection collection, long id, String labelField,
                              Object label) {
        Map<String, Object> key = Map.of(collection.getIdField(), id);
        if (tx.findOne(collection, key).isPresent()) {
            return;
        }
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>(key);
        if (label != null) {
            row.put(labelField, label);
        }
        row.put("createdAt", now);
        row.put("updatedAt", now);
        tx.insert(collection, row);
        logger.debug("Created stub {} row {}", collection.getCollectionName(), id);
    }

    private static StoreCollection collectionOf(ExtractedRecord record) {
        if (record instanceof EventRecord) {
            return StoreCollection.EVENTS;
        }
        if (record instanceof TeamRecord) {
            return StoreCollection.TEAMS;
        }
        if (record instanceof PlayerRecord) {
            return StoreCollection.PLAYERS;
        }
        if (record instanceof EventStatRecord) {
            return StoreCollection.EVENT_STATS;
        }
        if (record instanceof AssociationRecord association) {
            return association.kind() == AssociationKind.EVENT_TEAM
                ? StoreCollection.EVENT_TEAMS
                : StoreCollection.TEAM_PLAYERS;
        }
        throw new IllegalArgumentException("Unsupported record type: " + record.getClass().getSimpleName());
    }
}
