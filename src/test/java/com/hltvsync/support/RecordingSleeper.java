package com.hltvsync.support;

import org.springframework.retry.backoff.Sleeper;

import java.util.ArrayList;
import java.util.List;

/**
 * Sleeper that records requested waits and advances a {@link MutableClock} instead of blocking.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Long> sleeps = new ArrayList<>();
    private final MutableClock clock;

    public RecordingSleeper() {
        this(null);
    }

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void sleep(long backOffPeriod) {
        sleeps.add(backOffPeriod);
        if (clock != null) {
            clock.advanceMillis(backOffPeriod);
        }
    }

    public synchronized List<Long> getSleeps() {
        return new ArrayList<>(sleeps);
    }
}
