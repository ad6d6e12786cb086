package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;

/**
 * Page-to-record contract for one page kind. Implementations are pure functions of the page.
 */
public interface PageParser {

    PageKind pageKind();

    Extraction parse(PageContent page) throws ExtractionException;
}
