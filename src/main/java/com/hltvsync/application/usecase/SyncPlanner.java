package com.hltvsync.application.usecase;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.exception.FetchException;
import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.EntityRef;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.ScopeDirective;
import com.hltvsync.domain.model.SyncLimits;
import com.hltvsync.domain.model.UnitOfWork;
import com.hltvsync.domain.ports.PageExtractor;
import com.hltvsync.domain.ports.PageSource;
import com.hltvsync.domain.ports.RecordStore;
import com.hltvsync.domain.ports.StoreCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Derives root units from a scope directive and child units from a committed unit.
 */
@Component
public class SyncPlanner {

    private static final Logger logger = LoggerFactory.getLogger(SyncPlanner.class);

    private final PageSource pageSource;
    private final PageExtractor extractor;
    private final RecordStore recordStore;

    public SyncPlanner(PageSource pageSource, PageExtractor extractor, RecordStore recordStore) {
        this.pageSource = pageSource;
        this.extractor = extractor;
        this.recordStore = recordStore;
    }

    /**
     * A specific id yields one root. An unseen count reads the kind's listing, keeps its order,
     * skips stored ids and takes the first N, bounded by the kind's limit.
     */
    public List<UnitOfWork> planRoots(ScopeDirective scope, SyncLimits limits)
            throws FetchException, ExtractionException {
        PageKind root = PageKind.rootFor(scope.kind());
        if (scope.specificId() != null) {
            return List.of(new UnitOfWork(root, scope.specificId()));
        }

        PageContent listing = pageSource.fetch(PageKind.listingFor(scope.kind()), null);
        Extraction extraction = extractor.extract(listing);
        List<Long> listed = extraction.referencesOf(scope.kind()).stream()
            .map(EntityRef::externalId)
            .distinct()
            .toList();
        Set<Long> stored = recordStore.findExistingIds(collectionFor(scope.kind()), listed);

        int wanted = scope.unseenCount();
        int limit = limits.limitFor(root);
        if (limit > 0) {
            wanted = Math.min(wanted, limit);
        }
        List<UnitOfWork> roots = listed.stream()
            .filter(id -> !stored.contains(id))
            .limit(wanted)
            .map(id -> new UnitOfWork(root, id))
            .toList();
        logger.info("Listing {} has {} entries, {} already stored, {} planned",
            listing.requestedUrl(), listed.size(), stored.size(), roots.size());
        return roots;
    }

    /**
     * Children of a committed unit, only for full-stats scopes. Limits and deduplication are
     * applied by the run plan.
     */
    public List<UnitOfWork> childrenOf(UnitOfWork unit, Extraction extraction, ScopeDirective scope) {
        if (!scope.fullStats()) {
            return List.of();
        }
        return switch (unit.pageKind()) {
            case EVENT_OVERVIEW -> List.of(
                new UnitOfWork(PageKind.EVENT_RESULTS, unit.externalId()),
                new UnitOfWork(PageKind.EVENT_STATS, unit.externalId()));
            case EVENT_RESULTS -> unitsFor(extraction, EntityKind.TEAM, PageKind.TEAM_ROSTER);
            case TEAM_ROSTER -> unitsFor(extraction, EntityKind.PLAYER, PageKind.PLAYER_PROFILE);
            default -> List.of();
        };
    }

    static StoreCollection collectionFor(EntityKind kind) {
        return switch (kind) {
            case EVENT -> StoreCollection.EVENTS;
            case TEAM -> StoreCollection.TEAMS;
            case PLAYER -> StoreCollection.PLAYERS;
        };
    }

    private static List<UnitOfWork> unitsFor(Extraction extraction, EntityKind kind, PageKind pageKind) {
        return extraction.referencesOf(kind).stream()
            .map(ref -> new UnitOfWork(pageKind, ref.externalId()))
            .distinct()
            .toList();
    }
}
