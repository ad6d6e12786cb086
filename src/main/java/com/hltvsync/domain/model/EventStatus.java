package com.hltvsync.domain.model;

/**
 * Lifecycle status of an event, derived from its dates at fetch time.
 */
public enum EventStatus {
    UPCOMING,
    ONGOING,
    FINISHED,
    CANCELLED
}
