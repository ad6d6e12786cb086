package com.hltvsync.domain.model;

/**
 * States of one sync run. DONE and FAILED are terminal.
 */
public enum RunState {
    PLANNING,
    FETCHING,
    RECONCILING,
    CHECKPOINTED,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
