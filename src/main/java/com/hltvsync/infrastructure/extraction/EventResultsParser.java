package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.AssociationRecord;
import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.EntityRef;
import com.hltvsync.domain.model.ExtractedRecord;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.TeamRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Final placements and prizes of an event. Before the event finished only the attending
 * teams are listed; they are linked to the event without placement.
 */
@Component
public class EventResultsParser implements PageParser {

    private static final Pattern PLACEMENT = Pattern.compile("(\\d+)(?:st|nd|rd|th)\\b");

    @Override
    public PageKind pageKind() {
        return PageKind.EVENT_RESULTS;
    }

    @Override
    public Extraction parse(PageContent page) throws ExtractionException {
        Document document = Jsoup.parse(page.html(), page.finalUrl() == null ? "" : page.finalUrl());
        long eventId = PageIdentity.require(document, page, "events");

        List<ExtractedRecord> records = new ArrayList<>();
        List<EntityRef> references = new ArrayList<>();
        Set<Long> seen = new LinkedHashSet<>();

        for (Element placement : document.select(".placements .placement")) {
            Element link = placement.selectFirst("a[href*=/team/]");
            Long teamId = link == null ? null : NormalizationUtils.idAfterSegment(link.attr("href"), "team");
            if (teamId == null || !seen.add(teamId)) {
                continue;
            }
            String name = teamName(placement, link);

            Map<String, Object> attributes = new LinkedHashMap<>();
            Integer rank = placementOf(placement);
            if (rank != null) {
                attributes.put("placement", rank);
            }
            Element prize = placement.selectFirst(".prizeMoney");
            if (prize != null) {
                attributes.put("prize", NormalizationUtils.isPlaceholder(prize.text())
                    ? null
                    : NormalizationUtils.cleanText(prize.text()));
            }

            records.add(TeamRecord.stub(teamId, name));
            records.add(AssociationRecord.eventTeam(eventId, teamId, attributes));
            references.add(new EntityRef(EntityKind.TEAM, teamId, name));
        }

        if (seen.isEmpty()) {
            for (Element box : document.select(".teams-attending .team-box")) {
                Element link = box.selectFirst("a[href*=/team/]");
                Long teamId = link == null ? null : NormalizationUtils.idAfterSegment(link.attr("href"), "team");
                if (teamId == null || !seen.add(teamId)) {
                    continue;
                }
                String name = teamName(box, link);
                records.add(TeamRecord.stub(teamId, name));
                records.add(AssociationRecord.eventTeam(eventId, teamId, Map.of()));
                references.add(new EntityRef(EntityKind.TEAM, teamId, name));
            }
        }

        return new Extraction(pageKind(), eventId, page.requestedUrl(), page.fetchedAt(), records, references);
    }

    private static Integer placementOf(Element placement) {
        Matcher matcher = PLACEMENT.matcher(placement.text());
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }

    private static String teamName(Element container, Element link) {
        Element nameElement = container.selectFirst(".team-name, .text");
        String name = NormalizationUtils.cleanText(nameElement != null ? nameElement.text() : link.text());
        if (name == null) {
            Element logo = container.selectFirst("img[title]");
            name = logo == null ? null : NormalizationUtils.cleanText(logo.attr("title"));
        }
        return name;
    }
}
