package com.hltvsync.domain.exception;

import com.hltvsync.domain.model.PageKind;

/**
 * A page could not be turned into records. Not retried with the same input.
 */
public class ExtractionException extends Exception {

    private final PageKind pageKind;
    private final String url;

    public ExtractionException(PageKind pageKind, String url, String message) {
        this(pageKind, url, message, null);
    }

    public ExtractionException(PageKind pageKind, String url, String message, Throwable cause) {
        super(pageKind + " " + url + ": " + message, cause);
        this.pageKind = pageKind;
        this.url = url;
    }

    public PageKind getPageKind() {
        return pageKind;
    }

    public String getUrl() {
        return url;
    }
}
