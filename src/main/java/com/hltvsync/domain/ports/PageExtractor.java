package com.hltvsync.domain.ports;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;

/**
 * Port for turning a loaded page into typed records. Implementations do no I/O.
 */
public interface PageExtractor {

    Extraction extract(PageContent page) throws ExtractionException;
}
