package com.hltvsync.domain.model;

/**
 * Entity kinds that form the sync dependency graph.
 */
public enum EntityKind {
    EVENT,
    TEAM,
    PLAYER
}
