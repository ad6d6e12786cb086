package com.hltvsync.infrastructure.session;

/**
 * How a page kind is loaded: a scripted browser, or a plain HTTP client.
 */
public enum Renderer {
    BROWSER,
    HTTP
}
