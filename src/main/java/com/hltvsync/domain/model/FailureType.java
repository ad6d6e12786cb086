package com.hltvsync.domain.model;

/**
 * Classification of a failed unit of work.
 */
public enum FailureType {

    /** Anti-bot challenge still present after the last attempt. */
    BLOCKED,

    /** Network, timeout or readiness failure after the last attempt. */
    TRANSIENT,

    /** Unidentifiable or structurally invalid page. Never retried with the same input. */
    EXTRACTION,

    /** Constraint violation while reconciling the unit. */
    PERSISTENCE
}
