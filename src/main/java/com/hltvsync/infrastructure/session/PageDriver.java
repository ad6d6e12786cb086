package com.hltvsync.infrastructure.session;

import com.hltvsync.domain.exception.TransientFetchException;

/**
 * Opens driver sessions for one renderer.
 */
public interface PageDriver {

    Renderer renderer();

    DriverSession open(FingerprintProfile profile) throws TransientFetchException;

    /**
     * One isolated browsing context: own cookies, own fingerprint.
     */
    interface DriverSession extends AutoCloseable {

        /**
         * Navigates and waits for the readiness selector up to the page's ready timeout.
         * Network errors and navigation timeouts are reported as transient failures.
         */
        RawPage navigate(String url, PageSpec spec) throws TransientFetchException;

        @Override
        void close();
    }

    /**
     * What came back from a navigation, before classification.
     */
    record RawPage(int statusCode, String finalUrl, String html, boolean ready) {
    }
}
