package com.hltvsync.infrastructure.session;

import com.hltvsync.domain.model.PageKind;

import java.time.Instant;

/**
 * A pooled driver session bound to one page kind.
 */
public class Session {

    private final long id;
    private final PageKind pageKind;
    private final FingerprintProfile profile;
    private final PageDriver.DriverSession driverSession;
    private final int generation;
    private Instant lastNavigationAt;
    private int navigations;
    private boolean suspect;

    Session(long id, PageKind pageKind, FingerprintProfile profile, PageDriver.DriverSession driverSession,
            int generation) {
        this.id = id;
        this.pageKind = pageKind;
        this.profile = profile;
        this.driverSession = driverSession;
        this.generation = generation;
    }

    public long getId() {
        return id;
    }

    public PageKind getPageKind() {
        return pageKind;
    }

    public FingerprintProfile getProfile() {
        return profile;
    }

    PageDriver.DriverSession getDriverSession() {
        return driverSession;
    }

    int getGeneration() {
        return generation;
    }

    public Instant getLastNavigationAt() {
        return lastNavigationAt;
    }

    public int getNavigations() {
        return navigations;
    }

    public boolean isSuspect() {
        return suspect;
    }

    void recordNavigation(Instant at) {
        this.lastNavigationAt = at;
        this.navigations++;
    }

    void markSuspect() {
        this.suspect = true;
    }

    @Override
    public String toString() {
        return "Session#" + id + "[" + pageKind + "]";
    }
}
