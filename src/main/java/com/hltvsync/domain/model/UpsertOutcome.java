package com.hltvsync.domain.model;

public enum UpsertOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED
}
