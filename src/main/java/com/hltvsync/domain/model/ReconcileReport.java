package com.hltvsync.domain.model;

/**
 * Upsert outcome counts for one or more units.
 */
public record ReconcileReport(int inserted, int updated, int unchanged) {

    public static ReconcileReport empty() {
        return new ReconcileReport(0, 0, 0);
    }

    public ReconcileReport plus(UpsertOutcome outcome) {
        return switch (outcome) {
            case INSERTED -> new ReconcileReport(inserted + 1, updated, unchanged);
            case UPDATED -> new ReconcileReport(inserted, updated + 1, unchanged);
            case UNCHANGED -> new ReconcileReport(inserted, updated, unchanged + 1);
        };
    }

    public ReconcileReport plus(ReconcileReport other) {
        return new ReconcileReport(inserted + other.inserted, updated + other.updated, unchanged + other.unchanged);
    }
}
