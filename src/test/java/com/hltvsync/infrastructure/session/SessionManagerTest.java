package com.hltvsync.infrastructure.session;

import com.hltvsync.domain.exception.BlockedPageException;
import com.hltvsync.domain.exception.TransientFetchException;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.infrastructure.config.ScraperProperties;
import com.hltvsync.support.MutableClock;
import com.hltvsync.support.RecordingSleeper;
import com.hltvsync.support.ScriptedPageDriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SessionManagerTest {

    private static final String EVENT_URL = "https://www.hltv.org/events/8040/event";

    private ScriptedPageDriver driver;
    private MutableClock clock;
    private RecordingSleeper sleeper;
    private SessionManager sessionManager;

    @BeforeEach
    void setUp() {
        driver = new ScriptedPageDriver();
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        sleeper = new RecordingSleeper(clock);
        sessionManager = newManager(2, 3);
    }

    private SessionManager newManager(int maxSessions, int maxNavigations) {
        ScraperProperties properties = new ScraperProperties();
        properties.getSession().setMaxSessions(maxSessions);
        properties.getSession().setMaxNavigationsPerSession(maxNavigations);
        properties.getSession().setMinNavigationDelay(Duration.ofMillis(2500));
        properties.getSession().setNavigationJitter(Duration.ZERO);
        return new SessionManager(
            List.of(driver),
            new PageCatalog(properties),
            BlockedPageClassifier.withDefaults(),
            properties,
            clock,
            sleeper,
            new Random(7));
    }

    @Test
    void testReleasedSessionIsReusedForSameKind() throws Exception {
        Session first = sessionManager.acquire(PageKind.EVENT_OVERVIEW);
        sessionManager.load(first, EVENT_URL, 8040L);
        sessionManager.release(first);

        Session second = sessionManager.acquire(PageKind.EVENT_OVERVIEW);

        assertSame(first, second);
        assertEquals(1, driver.openedCount());
    }

    @Test
    void testSessionsAreNotSharedAcrossKinds() throws Exception {
        Session overview = sessionManager.acquire(PageKind.EVENT_OVERVIEW);
        sessionManager.release(overview);

        Session roster = sessionManager.acquire(PageKind.TEAM_ROSTER);

        assertNotSame(overview, roster);
        assertEquals(PageKind.TEAM_ROSTER, roster.getPageKind());
        assertEquals(2, driver.openedCount());
        assertEquals(1, sessionManager.idleSessionCount(PageKind.EVENT_OVERVIEW));
    }

    @Test
    void testIdleSessionOfOtherKindIsEvictedWhenPoolIsFull() throws Exception {
        sessionManager.release(sessionManager.acquire(PageKind.EVENT_OVERVIEW));
        sessionManager.release(sessionManager.acquire(PageKind.TEAM_ROSTER));

        Session profile = sessionManager.acquire(PageKind.PLAYER_PROFILE);

        assertEquals(PageKind.PLAYER_PROFILE, profile.getPageKind());
        assertEquals(3, driver.openedCount());
        assertEquals(1, driver.closedCount());
        assertEquals(2, sessionManager.openSessionCount());
    }

    @Test
    void testChallengeBurnsSession() throws Exception {
        driver.challenge();
        Session session = sessionManager.acquire(PageKind.EVENT_OVERVIEW);

        BlockedPageException blocked = assertThrows(BlockedPageException.class,
            () -> sessionManager.load(session, EVENT_URL, 8040L));
        sessionManager.release(session);

        assertTrue(blocked.getSignals().contains("title:just-a-moment"));
        assertTrue(session.isSuspect());
        assertEquals(1, driver.closedCount());
        assertEquals(0, sessionManager.openSessionCount());
        assertEquals(0, sessionManager.idleSessionCount(PageKind.EVENT_OVERVIEW));

        Session fresh = sessionManager.acquire(PageKind.EVENT_OVERVIEW);
        assertNotSame(session, fresh);
        assertEquals(2, driver.openedCount());
    }

    @Test
    void testThrottledResponseIsTransient() throws Exception {
        driver.respond(429, ScriptedPageDriver.READY_HTML);
        Session session = sessionManager.acquire(PageKind.EVENT_OVERVIEW);

        TransientFetchException failure = assertThrows(TransientFetchException.class,
            () -> sessionManager.load(session, EVENT_URL, 8040L));

        assertTrue(failure.getMessage().contains("429"));
        assertTrue(session.isSuspect());
    }

    @Test
    void testContentThatNeverBecomesReadyIsTransient() throws Exception {
        driver.respondNotReady();
        Session session = sessionManager.acquire(PageKind.EVENT_OVERVIEW);

        TransientFetchException failure = assertThrows(TransientFetchException.class,
            () -> sessionManager.load(session, EVENT_URL, 8040L));

        assertTrue(failure.getMessage().contains(".event-hub-title"));
    }

    @Test
    void testNavigationErrorMarksSessionSuspect() throws Exception {
        driver.fail("net::ERR_CONNECTION_RESET");
        Session session = sessionManager.acquire(PageKind.EVENT_OVERVIEW);

        assertThrows(TransientFetchException.class, () -> sessionManager.load(session, EVENT_URL, 8040L));

        assertTrue(session.isSuspect());
        assertEquals(1, session.getNavigations());
    }

    @Test
    void testNavigationBudgetRetiresSession() throws Exception {
        for (int i = 0; i < 3; i++) {
            Session session = sessionManager.acquire(PageKind.EVENT_OVERVIEW);
            sessionManager.load(session, EVENT_URL, 8040L);
            sessionManager.release(session);
        }

        assertEquals(1, driver.openedCount());
        assertEquals(1, driver.closedCount());
        assertEquals(0, sessionManager.idleSessionCount(PageKind.EVENT_OVERVIEW));
    }

    @Test
    void testNavigationsInSessionArePaced() throws Exception {
        Session session = sessionManager.acquire(PageKind.EVENT_OVERVIEW);
        sessionManager.load(session, EVENT_URL, 8040L);
        assertTrue(sleeper.getSleeps().isEmpty());

        clock.advanceMillis(1000);
        sessionManager.load(session, EVENT_URL, 8040L);

        assertEquals(List.of(1500L), sleeper.getSleeps());
    }

    @Test
    void testLoadReturnsPageContent() throws Exception {
        driver.respond(200, "<html><head><title>IEM Katowice 2024</title></head><body></body></html>");
        Session session = sessionManager.acquire(PageKind.EVENT_OVERVIEW);

        PageContent page = sessionManager.load(session, EVENT_URL, 8040L);

        assertEquals(PageKind.EVENT_OVERVIEW, page.pageKind());
        assertEquals(8040L, page.subjectId());
        assertEquals(EVENT_URL, page.finalUrl());
        assertEquals(200, page.statusCode());
        assertEquals(clock.instant(), page.fetchedAt());
    }

    @Test
    void testShutdownClosesIdleAndRetiresBusySessions() throws Exception {
        Session busy = sessionManager.acquire(PageKind.EVENT_OVERVIEW);
        sessionManager.release(sessionManager.acquire(PageKind.TEAM_ROSTER));

        sessionManager.shutdown();
        assertEquals(1, driver.closedCount());

        sessionManager.release(busy);
        assertEquals(2, driver.closedCount());
        assertEquals(0, sessionManager.openSessionCount());
    }
}
