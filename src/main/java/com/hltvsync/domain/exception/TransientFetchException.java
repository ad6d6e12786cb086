package com.hltvsync.domain.exception;

/**
 * Network error, timeout, throttling or a page whose content never became ready.
 */
public class TransientFetchException extends FetchException {

    public TransientFetchException(String message, String url) {
        super(message, url, null);
    }

    public TransientFetchException(String message, String url, Throwable cause) {
        super(message, url, cause);
    }
}
