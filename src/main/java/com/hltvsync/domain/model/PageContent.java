package com.hltvsync.domain.model;

import java.time.Instant;

/**
 * A loaded page. {@code subjectId} is the external id the page was requested for,
 * or null for listing pages.
 */
public record PageContent(
        PageKind pageKind,
        Long subjectId,
        String requestedUrl,
        String finalUrl,
        int statusCode,
        String html,
        Instant fetchedAt) {
}
