package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * World ranking, in ranking order.
 */
@Component
public class TeamListingParser implements PageParser {

    @Override
    public PageKind pageKind() {
        return PageKind.TEAM_LISTING;
    }

    @Override
    public Extraction parse(PageContent page) throws ExtractionException {
        Document document = Jsoup.parse(page.html(), page.finalUrl() == null ? "" : page.finalUrl());
        Element ranking = document.selectFirst(".ranking");
        if (ranking == null) {
            throw new ExtractionException(pageKind(), page.requestedUrl(), "ranking container missing");
        }

        List<ExtractedRecord> records = new ArrayList<>();
        List<EntityRef> references = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (Element team : ranking.select(".ranked-team")) {
            Element link = team.selectFirst("a.moreLink[href*=/team/], a[href*=/team/]");
            Long teamId = link == null ? null : NormalizationUtils.idAfterSegment(link.attr("href"), "team");
            if (teamId == null || !seen.add(teamId)) {
                continue;
            }
            Element nameElement = team.selectFirst(".teamLine .name, .name");
            String name = nameElement == null ? null : NormalizationUtils.cleanText(nameElement.text());
            Element position = team.selectFirst(".position");
            Integer rank = position == null ? null : NormalizationUtils.parseInteger(position.text());

            records.add(new TeamRecord(teamId, name, null, rank, Set.of()));
            references.add(new EntityRef(EntityKind.TEAM, teamId, name));
        }
        return new Extraction(pageKind(), null, page.requestedUrl(), page.fetchedAt(), records, references);
    }
}
