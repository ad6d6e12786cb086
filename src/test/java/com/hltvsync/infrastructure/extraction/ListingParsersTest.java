package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.EntityRef;
import com.hltvsync.domain.model.EventRecord;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.PlayerRecord;
import com.hltvsync.domain.model.TeamRecord;
import com.hltvsync.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListingParsersTest {

    private static final Instant FETCHED_AT = Instant.parse("2024-03-01T12:00:00Z");

    @Test
    void testEventListingKeepsOrderAndDropsDuplicates() throws Exception {
        Extraction extraction = new EventListingParser().parse(Fixtures.page(PageKind.EVENT_LISTING, null,
            "https://www.hltv.org/events", Fixtures.html("event-listing.html"), FETCHED_AT));

        List<Long> ids = extraction.referencesOf(EntityKind.EVENT).stream().map(EntityRef::externalId).toList();
        assertEquals(List.of(7148L, 7435L, 7553L), ids);
        assertEquals("IEM Katowice 2024", extraction.references().get(0).name());

        EventRecord major = (EventRecord) extraction.records().get(1);
        assertEquals("PGL Major Copenhagen 2024", major.name());
        assertEquals(LocalDate.of(2024, 3, 22), major.startDate());
    }

    @Test
    void testTeamListing() throws Exception {
        Extraction extraction = new TeamListingParser().parse(Fixtures.page(PageKind.TEAM_LISTING, null,
            "https://www.hltv.org/ranking/teams", Fixtures.html("team-listing.html"), FETCHED_AT));

        assertEquals(2, extraction.references().size());
        TeamRecord first = (TeamRecord) extraction.records().get(0);
        assertEquals(4608L, first.teamId());
        assertEquals("Natus Vincere", first.name());
        assertEquals(1, first.worldRank());
    }

    @Test
    void testPlayerListing() throws Exception {
        Extraction extraction = new PlayerListingParser().parse(Fixtures.page(PageKind.PLAYER_LISTING, null,
            "https://www.hltv.org/stats/players", Fixtures.html("player-listing.html"), FETCHED_AT));

        List<Long> ids = extraction.referencesOf(EntityKind.PLAYER).stream().map(EntityRef::externalId).toList();
        assertEquals(List.of(11893L, 8183L), ids);
        PlayerRecord niko = (PlayerRecord) extraction.records().get(1);
        assertEquals("NiKo", niko.nickname());
        assertEquals("Bosnia and Herzegovina", niko.country());
    }

    @Test
    void testListingWithoutContainerIsExtractionFailure() {
        assertThrows(ExtractionException.class, () -> new EventListingParser().parse(Fixtures.page(
            PageKind.EVENT_LISTING, null, "https://www.hltv.org/events", "<html><body></body></html>", FETCHED_AT)));
        assertThrows(ExtractionException.class, () -> new TeamListingParser().parse(Fixtures.page(
            PageKind.TEAM_LISTING, null, "https://www.hltv.org/ranking/teams", "<html></html>", FETCHED_AT)));
    }
}
