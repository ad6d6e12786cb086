package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.EntityRef;
import com.hltvsync.domain.model.EventRecord;
import com.hltvsync.domain.model.ExtractedRecord;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Events listing in page order.
 */
@Component
public class EventListingParser implements PageParser {

    @Override
    public PageKind pageKind() {
        return PageKind.EVENT_LISTING;
    }

    @Override
    public Extraction parse(PageContent page) throws ExtractionException {
        Document document = Jsoup.parse(page.html(), page.finalUrl() == null ? "" : page.finalUrl());
        Element holder = document.selectFirst(".events-holder");
        if (holder == null) {
            throw new ExtractionException(pageKind(), page.requestedUrl(), "events listing container missing");
        }

        List<ExtractedRecord> records = new ArrayList<>();
        List<EntityRef> references = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (Element link : holder.select("a.big-event, a.small-event, a.ongoing-event")) {
            Long eventId = NormalizationUtils.idAfterSegment(link.attr("href"), "events");
            if (eventId == null || !seen.add(eventId)) {
                continue;
            }
            Element nameElement = link.selectFirst(".big-event-name, .small-event-name, .event-name-small");
            String name = NormalizationUtils.cleanText(nameElement != null ? nameElement.text() : link.ownText());
            Element date = link.selectFirst("span[data-unix]");

            EventRecord stub = EventRecord.stub(eventId, name);
            if (date != null) {
                stub = new EventRecord(eventId, name, NormalizationUtils.utcDate(date.attr("data-unix")),
                    null, null, null, null, null, null, null, Set.of());
            }
            records.add(stub);
            references.add(new EntityRef(EntityKind.EVENT, eventId, name));
        }
        return new Extraction(pageKind(), null, page.requestedUrl(), page.fetchedAt(), records, references);
    }
}
