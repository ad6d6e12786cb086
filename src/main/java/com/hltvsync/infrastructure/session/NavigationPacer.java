package com.hltvsync.infrastructure.session;

import org.springframework.retry.backoff.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Random;

/**
 * Enforces the minimum delay plus random jitter between two navigations of one session.
 */
public class NavigationPacer {

    private final Duration minDelay;
    private final Duration jitter;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random random;

    public NavigationPacer(Duration minDelay, Duration jitter, Clock clock, Sleeper sleeper, Random random) {
        this.minDelay = minDelay;
        this.jitter = jitter;
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Waits until the session may navigate again. A session that never navigated goes at once.
     */
    public void awaitTurn(Session session) throws InterruptedException {
        Instant last = session.getLastNavigationAt();
        if (last == null) {
            return;
        }
        long jitterMillis = jitter.toMillis() > 0 ? (long) (random.nextDouble() * jitter.toMillis()) : 0L;
        long elapsed = Duration.between(last, clock.instant()).toMillis();
        long wait = Math.max(0L, minDelay.toMillis() - elapsed) + jitterMillis;
        if (wait > 0) {
            sleeper.sleep(wait);
        }
    }
}
