package com.hltvsync.domain.model;

/**
 * One page to fetch, extract and reconcile.
 */
public record UnitOfWork(PageKind pageKind, long externalId) {

    public String key() {
        return pageKind + ":" + externalId;
    }

    public int level() {
        return pageKind.getLevel();
    }

    public static UnitOfWork parse(String key) {
        int separator = key.lastIndexOf(':');
        if (separator <= 0) {
            throw new IllegalArgumentException("Malformed unit key: " + key);
        }
        return new UnitOfWork(
            PageKind.valueOf(key.substring(0, separator)),
            Long.parseLong(key.substring(separator + 1)));
    }
}
