package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.PageContent;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the external id a page is about and checks it against the requested one.
 */
final class PageIdentity {

    private PageIdentity() {
    }

    /**
     * Id from the canonical link, the og:url meta or the final url, in that order.
     */
    static long require(Document document, PageContent page, String... segments) throws ExtractionException {
        for (String candidate : candidates(document, page)) {
            Long id = NormalizationUtils.idAfterSegment(candidate, segments);
            if (id != null) {
                return verify(id, page);
            }
        }
        throw new ExtractionException(page.pageKind(), page.requestedUrl(), "identity fragment missing");
    }

    static long verify(long id, PageContent page) throws ExtractionException {
        if (page.subjectId() != null && page.subjectId() != id) {
            throw new ExtractionException(page.pageKind(), page.requestedUrl(),
                "page identifies " + id + " but " + page.subjectId() + " was requested");
        }
        return id;
    }

    private static List<String> candidates(Document document, PageContent page) {
        List<String> urls = new ArrayList<>();
        Element canonical = document.selectFirst("link[rel=canonical]");
        if (canonical != null) {
            urls.add(canonical.attr("href"));
        }
        Element ogUrl = document.selectFirst("meta[property=og:url]");
        if (ogUrl != null) {
            urls.add(ogUrl.attr("content"));
        }
        if (page.finalUrl() != null) {
            urls.add(page.finalUrl());
        }
        return urls;
    }
}
