package com.hltvsync.domain.exception;

import java.util.List;

/**
 * The site served an anti-bot challenge instead of content.
 */
public class BlockedPageException extends FetchException {

    private final List<String> signals;

    public BlockedPageException(String url, List<String> signals) {
        super("Blocked page at " + url + " (signals: " + signals + ")", url, null);
        this.signals = List.copyOf(signals);
    }

    @Override
    public List<String> getSignals() {
        return signals;
    }
}
