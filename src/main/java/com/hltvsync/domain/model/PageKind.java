package com.hltvsync.domain.model;

/**
 * Page kinds the engine knows how to fetch and extract.
 *
 * The level orders units into dependency waves: overviews first, then the per-event pages,
 * then rosters, then player profiles. Listing pages are only fetched while planning.
 */
public enum PageKind {
    EVENT_LISTING(EntityKind.EVENT, 0, true),
    TEAM_LISTING(EntityKind.TEAM, 0, true),
    PLAYER_LISTING(EntityKind.PLAYER, 0, true),
    EVENT_OVERVIEW(EntityKind.EVENT, 0, false),
    EVENT_RESULTS(EntityKind.EVENT, 1, false),
    EVENT_STATS(EntityKind.EVENT, 1, false),
    TEAM_ROSTER(EntityKind.TEAM, 2, false),
    PLAYER_PROFILE(EntityKind.PLAYER, 3, false);

    private final EntityKind entityKind;
    private final int level;
    private final boolean listing;

    PageKind(EntityKind entityKind, int level, boolean listing) {
        this.entityKind = entityKind;
        this.level = level;
        this.listing = listing;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public int getLevel() {
        return level;
    }

    public boolean isListing() {
        return listing;
    }

    /**
     * The unit planned for a specific-id directive of the given kind.
     */
    public static PageKind rootFor(EntityKind kind) {
        return switch (kind) {
            case EVENT -> EVENT_OVERVIEW;
            case TEAM -> TEAM_ROSTER;
            case PLAYER -> PLAYER_PROFILE;
        };
    }

    public static PageKind listingFor(EntityKind kind) {
        return switch (kind) {
            case EVENT -> EVENT_LISTING;
            case TEAM -> TEAM_LISTING;
            case PLAYER -> PLAYER_LISTING;
        };
    }
}
