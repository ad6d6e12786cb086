package com.hltvsync.domain.ports;

import com.hltvsync.domain.exception.FetchException;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;

/**
 * Port for loading pages, retries included.
 */
public interface PageSource {

    /**
     * Loads the page of the given kind for an external id, or the listing page when id is null.
     *
     * @throws FetchException when every attempt was blocked or failed transiently
     */
    PageContent fetch(PageKind pageKind, Long externalId) throws FetchException;

    /**
     * Resolves the url a fetch would load, for failure reports.
     */
    String urlFor(PageKind pageKind, Long externalId);

    /**
     * Releases every session. Called when a run completes.
     */
    void shutdown();
}
