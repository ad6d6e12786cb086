package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.ports.PageExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches a page to the parser registered for its kind.
 */
@Component
public class HltvPageExtractor implements PageExtractor {

    private static final Logger logger = LoggerFactory.getLogger(HltvPageExtractor.class);

    private final Map<PageKind, PageParser> parsers = new EnumMap<>(PageKind.class);

    public HltvPageExtractor(List<PageParser> parsers) {
        for (PageParser parser : parsers) {
            PageParser previous = this.parsers.put(parser.pageKind(), parser);
            if (previous != null) {
                throw new IllegalStateException("Two parsers registered for " + parser.pageKind());
            }
        }
    }

    @Override
    public Extraction extract(PageContent page) throws ExtractionException {
        PageParser parser = parsers.get(page.pageKind());
        if (parser == null) {
            throw new ExtractionException(page.pageKind(), page.requestedUrl(), "no parser registered");
        }
        if (page.html() == null || page.html().isBlank()) {
            throw new ExtractionException(page.pageKind(), page.requestedUrl(), "empty page");
        }
        Extraction extraction = parser.parse(page);
        logger.debug("Extracted {} records and {} references from {}",
            extraction.records().size(), extraction.references().size(), page.requestedUrl());
        return extraction;
    }
}
