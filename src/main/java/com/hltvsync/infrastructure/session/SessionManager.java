package com.hltvsync.infrastructure.session;

import com.hltvsync.domain.exception.BlockedPageException;
import com.hltvsync.domain.exception.FetchException;
import com.hltvsync.domain.exception.TransientFetchException;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.infrastructure.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of driver sessions.
 *
 * Idle sessions are kept per page kind and never handed to another kind. A session that hit a
 * challenge or a failed load is closed on release, as is one that reached its navigation budget.
 * The pool starts on the first acquire and is torn down by {@link #shutdown()}.
 */
@Component
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    private final Map<Renderer, PageDriver> drivers = new EnumMap<>(Renderer.class);
    private final PageCatalog catalog;
    private final BlockedPageClassifier classifier;
    private final NavigationPacer pacer;
    private final Clock clock;
    private final Random random;
    private final int maxSessions;
    private final int maxNavigationsPerSession;

    private final Object lock = new Object();
    private final Map<PageKind, Deque<Session>> idle = new EnumMap<>(PageKind.class);
    private final AtomicLong sessionIds = new AtomicLong();
    private int openSessions;
    private int generation;
    private boolean started;

    public SessionManager(
            List<PageDriver> drivers,
            PageCatalog catalog,
            BlockedPageClassifier classifier,
            ScraperProperties properties,
            Clock clock,
            Sleeper sleeper,
            Random random) {
        drivers.forEach(driver -> this.drivers.put(driver.renderer(), driver));
        this.catalog = catalog;
        this.classifier = classifier;
        this.clock = clock;
        this.random = random;
        ScraperProperties.Session settings = properties.getSession();
        this.maxSessions = Math.max(1, settings.getMaxSessions());
        this.maxNavigationsPerSession = Math.max(1, settings.getMaxNavigationsPerSession());
        this.pacer = new NavigationPacer(
            settings.getMinNavigationDelay(), settings.getNavigationJitter(), clock, sleeper, random);
    }

    /**
     * Returns an idle session of the kind, or opens a fresh one. Blocks while the pool is full
     * of sessions in use.
     */
    public Session acquire(PageKind kind) throws TransientFetchException {
        PageSpec spec = catalog.specFor(kind);
        PageDriver driver = drivers.get(spec.renderer());
        if (driver == null) {
            throw new IllegalStateException("No page driver registered for renderer " + spec.renderer());
        }

        List<Session> evicted = new ArrayList<>();
        int sessionGeneration;
        synchronized (lock) {
            if (!started) {
                started = true;
                logger.info("Session pool started (max {} sessions)", maxSessions);
            }
            while (true) {
                Deque<Session> pool = idle.get(kind);
                if (pool != null && !pool.isEmpty()) {
                    return pool.pollFirst();
                }
                if (openSessions < maxSessions) {
                    openSessions++;
                    break;
                }
                Session victim = pollIdleOfOtherKind(kind);
                if (victim != null) {
                    openSessions--;
                    evicted.add(victim);
                    continue;
                }
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TransientFetchException("Interrupted while waiting for a session", null, e);
                }
            }
            sessionGeneration = generation;
        }
        evicted.forEach(this::closeQuietly);

        FingerprintProfile profile = FingerprintProfile.random(random);
        try {
            PageDriver.DriverSession driverSession = driver.open(profile);
            Session session = new Session(sessionIds.incrementAndGet(), kind, profile, driverSession, sessionGeneration);
            logger.debug("Opened {} with user agent {}", session, profile.userAgent());
            return session;
        } catch (TransientFetchException | RuntimeException e) {
            synchronized (lock) {
                openSessions--;
                lock.notifyAll();
            }
            throw e;
        }
    }

    /**
     * Loads the url in the session and classifies the result.
     *
     * @throws BlockedPageException when the page is an anti-bot challenge
     * @throws TransientFetchException on throttling, server errors, timeouts or content that
     *                                 never became ready
     */
    public PageContent load(Session session, String url, Long subjectId) throws FetchException {
        PageSpec spec = catalog.specFor(session.getPageKind());
        try {
            pacer.awaitTurn(session);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException("Interrupted while pacing navigation", url, e);
        }

        PageDriver.RawPage raw;
        try {
            raw = session.getDriverSession().navigate(url, spec);
        } catch (TransientFetchException e) {
            session.markSuspect();
            throw e;
        } finally {
            session.recordNavigation(clock.instant());
        }

        BlockedPageClassifier.Classification classification = classifier.classify(raw.html(), raw.finalUrl());
        if (classification.blocked()) {
            session.markSuspect();
            logger.warn("{} blocked at {} (signals: {})", session, url, classification.matchedSignals());
            throw new BlockedPageException(url, classification.matchedSignals());
        }
        if (raw.statusCode() == 429 || raw.statusCode() >= 500) {
            session.markSuspect();
            throw new TransientFetchException("HTTP status " + raw.statusCode(), url);
        }
        if (!raw.ready()) {
            session.markSuspect();
            throw new TransientFetchException("Ready selector '" + spec.readySelector() + "' never appeared", url);
        }
        return new PageContent(
            session.getPageKind(), subjectId, url, raw.finalUrl(), raw.statusCode(), raw.html(), clock.instant());
    }

    /**
     * Returns the session to its kind's idle pool, or closes it when it must not be reused.
     */
    public void release(Session session) {
        boolean retire;
        synchronized (lock) {
            retire = session.isSuspect()
                || session.getNavigations() >= maxNavigationsPerSession
                || session.getGeneration() != generation;
            if (retire) {
                openSessions--;
            } else {
                idle.computeIfAbsent(session.getPageKind(), k -> new ArrayDeque<>()).addLast(session);
            }
            lock.notifyAll();
        }
        if (retire) {
            logger.debug("Retiring {} (suspect: {}, navigations: {})",
                session, session.isSuspect(), session.getNavigations());
            closeQuietly(session);
        }
    }

    /**
     * Closes every idle session. Sessions still in use are closed when released.
     */
    public void shutdown() {
        List<Session> toClose = new ArrayList<>();
        synchronized (lock) {
            if (!started) {
                return;
            }
            idle.values().forEach(toClose::addAll);
            idle.clear();
            openSessions -= toClose.size();
            generation++;
            started = false;
            lock.notifyAll();
        }
        toClose.forEach(this::closeQuietly);
        logger.info("Session pool shut down ({} idle sessions closed)", toClose.size());
    }

    public int openSessionCount() {
        synchronized (lock) {
            return openSessions;
        }
    }

    public int idleSessionCount(PageKind kind) {
        synchronized (lock) {
            Deque<Session> pool = idle.get(kind);
            return pool == null ? 0 : pool.size();
        }
    }

    private Session pollIdleOfOtherKind(PageKind kind) {
        for (Map.Entry<PageKind, Deque<Session>> entry : idle.entrySet()) {
            if (entry.getKey() != kind && !entry.getValue().isEmpty()) {
                return entry.getValue().pollFirst();
            }
        }
        return null;
    }

    private void closeQuietly(Session session) {
        try {
            session.getDriverSession().close();
        } catch (RuntimeException e) {
            logger.warn("Failed to close {}: {}", session, e.getMessage());
        }
    }
}
