package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.EventRecord;
import com.hltvsync.domain.model.EventStatus;
import com.hltvsync.domain.model.EventType;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.support.Fixtures;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventOverviewParserTest {

    private static final String URL = "https://www.hltv.org/events/7148/event";
    private static final Instant FETCHED_AT = Instant.parse("2024-03-01T12:00:00Z");

    private final EventOverviewParser parser = new EventOverviewParser();

    @Test
    void testParseFinishedLanEvent() throws Exception {
        PageContent page = Fixtures.page(PageKind.EVENT_OVERVIEW, 7148L, URL,
            Fixtures.html("event-overview-7148.html"), FETCHED_AT);

        Extraction extraction = parser.parse(page);

        assertEquals(7148L, extraction.subjectId());
        assertEquals(1, extraction.records().size());
        assertTrue(extraction.references().isEmpty());

        EventRecord event = (EventRecord) extraction.records().get(0);
        assertEquals(7148L, event.eventId());
        assertEquals("IEM Katowice 2024", event.name());
        assertEquals(LocalDate.of(2024, 1, 31), event.startDate());
        assertEquals(LocalDate.of(2024, 2, 11), event.endDate());
        assertEquals("Katowice, Poland", event.location());
        assertEquals("$1,000,000", event.prizePool());
        assertEquals(24, event.teamsCount());
        assertEquals(EventType.LAN, event.eventType());
        assertEquals(EventStatus.FINISHED, event.status());
        assertTrue(event.emptyFields().isEmpty());
    }

    @Test
    void testUndecodableBracketIsSkipped() throws Exception {
        PageContent page = Fixtures.page(PageKind.EVENT_OVERVIEW, 7148L, URL,
            Fixtures.html("event-overview-7148.html"), FETCHED_AT);

        EventRecord event = (EventRecord) parser.parse(page).records().get(0);

        assertEquals(1, event.brackets().size());
        Map<String, Object> bracket = event.brackets().get(0);
        assertEquals("Playoffs", bracket.get("name"));
        assertEquals(3, bracket.get("rounds"));
    }

    @Test
    void testPlaceholdersAreIntentionallyEmpty() throws Exception {
        String html = "<html><head><link rel=\"canonical\" href=\"https://www.hltv.org/events/7600/cct-online\">"
            + "</head><body><h1 class=\"event-hub-title\">CCT Season 2 Europe</h1>"
            + "<table class=\"info\"><tr>"
            + "<td class=\"eventdate\"><span data-unix=\"1712016000000\">Apr 2nd</span></td>"
            + "<td class=\"prizepool\">TBA</td>"
            + "<td class=\"teamsNumber\">TBA</td>"
            + "<td class=\"location\"><span class=\"text-ellipsis\">Europe (Online)</span></td>"
            + "</tr></table></body></html>";
        PageContent page = Fixtures.page(PageKind.EVENT_OVERVIEW, 7600L, "https://www.hltv.org/events/7600/event",
            html, FETCHED_AT);

        EventRecord event = (EventRecord) parser.parse(page).records().get(0);

        assertNull(event.prizePool());
        assertNull(event.teamsCount());
        assertTrue(event.emptyFields().contains("prizePool"));
        assertTrue(event.emptyFields().contains("teamsCount"));
        assertTrue(event.fields().containsKey("prizePool"));
        assertNull(event.fields().get("prizePool"));
        assertFalse(event.fields().containsKey("brackets"));
        assertEquals(EventType.ONLINE, event.eventType());
        assertEquals(EventStatus.UPCOMING, event.status());
        assertEquals(event.startDate(), event.endDate());
    }

    @Test
    void testIdentityMismatchIsRejected() {
        PageContent page = Fixtures.page(PageKind.EVENT_OVERVIEW, 9999L, "https://www.hltv.org/events/9999/event",
            Fixtures.html("event-overview-7148.html"), FETCHED_AT);

        ExtractionException failure = assertThrows(ExtractionException.class, () -> parser.parse(page));

        assertEquals(PageKind.EVENT_OVERVIEW, failure.getPageKind());
        assertTrue(failure.getMessage().contains("7148"));
    }

    @Test
    void testMissingIdentityIsRejected() {
        PageContent page = Fixtures.page(PageKind.EVENT_OVERVIEW, null, "https://www.hltv.org/",
            "<html><body><h1>Home</h1></body></html>", FETCHED_AT);

        assertThrows(ExtractionException.class, () -> parser.parse(page));
    }

    @Test
    void testEventTypeOfLocation() {
        assertEquals(EventType.LAN, EventOverviewParser.eventTypeOf("Helsinki, Finland"));
        assertEquals(EventType.ONLINE, EventOverviewParser.eventTypeOf("Online"));
        assertEquals(EventType.ONLINE, EventOverviewParser.eventTypeOf("Europe (Online)"));
        assertEquals(EventType.MIXED, EventOverviewParser.eventTypeOf("Online | Cologne, Germany"));
        assertEquals(EventType.MIXED, EventOverviewParser.eventTypeOf("Online & LAN"));
        assertNull(EventOverviewParser.eventTypeOf(null));
    }

    @Test
    void testStatusOfDates() {
        LocalDate start = LocalDate.of(2024, 3, 1);
        LocalDate end = LocalDate.of(2024, 3, 10);

        assertEquals(EventStatus.ONGOING, EventOverviewParser.statusOf(Jsoup.parse(""), start, end, FETCHED_AT));
        assertEquals(EventStatus.ONGOING,
            EventOverviewParser.statusOf(Jsoup.parse(""), start, end, Instant.parse("2024-03-10T23:00:00Z")));
        assertEquals(EventStatus.FINISHED,
            EventOverviewParser.statusOf(Jsoup.parse(""), start, end, Instant.parse("2024-03-11T00:00:00Z")));
        assertEquals(EventStatus.UPCOMING,
            EventOverviewParser.statusOf(Jsoup.parse(""), start, end, Instant.parse("2024-02-29T23:59:59Z")));
        assertEquals(EventStatus.CANCELLED, EventOverviewParser.statusOf(
            Jsoup.parse("<div class=\"event-cancelled\">Event cancelled</div>"), start, end, FETCHED_AT));
        assertNull(EventOverviewParser.statusOf(Jsoup.parse(""), null, null, FETCHED_AT));
    }
}
