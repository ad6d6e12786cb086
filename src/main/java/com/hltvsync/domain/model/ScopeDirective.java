package com.hltvsync.domain.model;

/**
 * What a sync run should cover: one entity by id, or the first N entities of a kind's listing
 * that are not stored yet. With {@code fullStats} the run descends into dependent pages.
 */
public record ScopeDirective(EntityKind kind, Long specificId, Integer unseenCount, boolean fullStats) {

    public ScopeDirective {
        if (kind == null) {
            throw new IllegalArgumentException("Scope kind is required");
        }
        if ((specificId == null) == (unseenCount == null)) {
            throw new IllegalArgumentException("Exactly one of specificId or unseenCount must be set");
        }
        if (specificId != null && specificId <= 0) {
            throw new IllegalArgumentException("specificId must be positive: " + specificId);
        }
        if (unseenCount != null && unseenCount <= 0) {
            throw new IllegalArgumentException("unseenCount must be positive: " + unseenCount);
        }
    }

    public static ScopeDirective specific(EntityKind kind, long id, boolean fullStats) {
        return new ScopeDirective(kind, id, null, fullStats);
    }

    public static ScopeDirective unseen(EntityKind kind, int count, boolean fullStats) {
        return new ScopeDirective(kind, null, count, fullStats);
    }

    /**
     * Stable key under which the run's checkpoint is stored.
     */
    public String key() {
        String selector = specificId != null ? "id=" + specificId : "unseen=" + unseenCount;
        return kind + ":" + selector + (fullStats ? ":full" : ":basic");
    }
}
