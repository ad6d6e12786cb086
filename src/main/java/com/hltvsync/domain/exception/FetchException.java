package com.hltvsync.domain.exception;

import java.util.List;

/**
 * A page could not be loaded in a usable state. Retried by the page fetcher.
 */
public abstract class FetchException extends Exception {

    private final String url;
    private int attempts = 1;

    protected FetchException(String message, String url, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    /**
     * Classifier signals that matched on the last attempt, empty when none did.
     */
    public List<String> getSignals() {
        return List.of();
    }
}
