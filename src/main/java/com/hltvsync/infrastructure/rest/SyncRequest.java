package com.hltvsync.infrastructure.rest;

import com.hltvsync.domain.model.ScopeDirective;
import com.hltvsync.domain.model.SyncLimits;

/**
 * Body of {@code POST /sync}. Missing limits mean unlimited.
 */
public record SyncRequest(ScopeDirective scope, SyncLimits limits) {

    public SyncLimits limitsOrUnlimited() {
        return limits == null ? SyncLimits.unlimited() : limits;
    }
}
