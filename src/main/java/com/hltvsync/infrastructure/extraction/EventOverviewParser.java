package com.hltvsync.infrastructure.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.EventRecord;
import com.hltvsync.domain.model.EventStatus;
import com.hltvsync.domain.model.EventType;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Event overview page: dates, prize pool, location, team count and the embedded brackets.
 */
@Component
public class EventOverviewParser implements PageParser {

    private static final Logger logger = LoggerFactory.getLogger(EventOverviewParser.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    @Override
    public PageKind pageKind() {
        return PageKind.EVENT_OVERVIEW;
    }

    @Override
    public Extraction parse(PageContent page) throws ExtractionException {
        Document document = Jsoup.parse(page.html(), page.finalUrl() == null ? "" : page.finalUrl());
        long eventId = PageIdentity.require(document, page, "events");
        Set<String> emptyFields = new HashSet<>();

        String name = text(document.selectFirst(".event-hub-title"));
        if (name == null) {
            name = text(document.selectFirst("h1"));
        }

        Elements dates = document.select("table.info td.eventdate span[data-unix]");
        LocalDate startDate = dates.isEmpty() ? null : NormalizationUtils.utcDate(dates.first().attr("data-unix"));
        LocalDate endDate = dates.size() < 2 ? startDate : NormalizationUtils.utcDate(dates.last().attr("data-unix"));

        String prizePool = null;
        Element prizeCell = document.selectFirst("table.info td.prizepool");
        if (prizeCell != null) {
            if (NormalizationUtils.isPlaceholder(prizeCell.text())) {
                emptyFields.add("prizePool");
            } else {
                prizePool = NormalizationUtils.cleanText(prizeCell.text());
            }
        }

        Integer teamsCount = null;
        Element teamsCell = document.selectFirst("table.info td.teamsNumber");
        if (teamsCell != null) {
            teamsCount = NormalizationUtils.parseInteger(teamsCell.text());
            if (teamsCount == null) {
                emptyFields.add("teamsCount");
            }
        }

        Element locationCell = document.selectFirst("table.info td.location");
        String location = null;
        if (locationCell != null) {
            Element ellipsis = locationCell.selectFirst("span.text-ellipsis");
            location = NormalizationUtils.cleanText(ellipsis != null ? ellipsis.text() : locationCell.text());
        }

        EventRecord record = new EventRecord(
            eventId,
            name,
            startDate,
            endDate,
            location,
            prizePool,
            eventTypeOf(location),
            statusOf(document, startDate, endDate, page.fetchedAt()),
            teamsCount,
            brackets(document, page),
            emptyFields);

        return new Extraction(pageKind(), eventId, page.requestedUrl(), page.fetchedAt(), List.of(record), List.of());
    }

    /**
     * "Online" or "Europe (Online)" is online, a location combined with online play is mixed,
     * anything else is a LAN.
     */
    static EventType eventTypeOf(String location) {
        if (location == null) {
            return null;
        }
        String lower = location.toLowerCase(Locale.ROOT);
        if (!lower.contains("online")) {
            return EventType.LAN;
        }
        boolean combined = lower.contains("|") || lower.contains("&") || lower.contains(" + ")
            || lower.matches(".*\\blan\\b.*");
        return combined ? EventType.MIXED : EventType.ONLINE;
    }

    /**
     * Status relative to the fetch time. Dates are whole UTC days, so the end day counts as ongoing.
     */
    static EventStatus statusOf(Document document, LocalDate start, LocalDate end, Instant fetchedAt) {
        if (document.selectFirst(".event-cancelled") != null
            || document.title().toLowerCase(Locale.ROOT).contains("cancelled")) {
            return EventStatus.CANCELLED;
        }
        if (start == null || fetchedAt == null) {
            return null;
        }
        LocalDate today = fetchedAt.atOffset(ZoneOffset.UTC).toLocalDate();
        LocalDate last = end != null ? end : start;
        if (today.isBefore(start)) {
            return EventStatus.UPCOMING;
        }
        if (today.isAfter(last)) {
            return EventStatus.FINISHED;
        }
        return EventStatus.ONGOING;
    }

    private List<Map<String, Object>> brackets(Document document, PageContent page) {
        Elements holders = document.select("[data-slotted-bracket-json]");
        if (holders.isEmpty()) {
            return null;
        }
        List<Map<String, Object>> brackets = new ArrayList<>();
        for (Element holder : holders) {
            String raw = holder.attr("data-slotted-bracket-json");
            if (raw.contains("&quot;")) {
                raw = Parser.unescapeEntities(raw, true);
            }
            try {
                brackets.add(OBJECT_MAPPER.readValue(raw, JSON_OBJECT));
            } catch (JsonProcessingException e) {
                logger.warn("Skipping undecodable bracket payload on {}: {}", page.requestedUrl(), e.getOriginalMessage());
            }
        }
        return brackets.isEmpty() ? null : brackets;
    }

    private static String text(Element element) {
        return element == null ? null : NormalizationUtils.cleanText(element.text());
    }
}
