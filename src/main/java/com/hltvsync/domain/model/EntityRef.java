package com.hltvsync.domain.model;

/**
 * Reference to an entity discovered on a page, in page order.
 */
public record EntityRef(EntityKind kind, long externalId, String name) {
}
