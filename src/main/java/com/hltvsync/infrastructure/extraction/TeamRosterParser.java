package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.AssociationRecord;
import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.EntityRef;
import com.hltvsync.domain.model.ExtractedRecord;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.PlayerRecord;
import com.hltvsync.domain.model.TeamRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Team profile with its current roster. Roster entries are dated by the fetch day.
 */
@Component
public class TeamRosterParser implements PageParser {

    @Override
    public PageKind pageKind() {
        return PageKind.TEAM_ROSTER;
    }

    @Override
    public Extraction parse(PageContent page) throws ExtractionException {
        Document document = Jsoup.parse(page.html(), page.finalUrl() == null ? "" : page.finalUrl());
        long teamId = PageIdentity.require(document, page, "team");
        Set<String> emptyFields = new HashSet<>();

        Element nameElement = document.selectFirst(".profile-team-name");
        String name = nameElement == null ? null : NormalizationUtils.cleanText(nameElement.text());

        String country = null;
        Element flag = document.selectFirst(".team-country .flag");
        if (flag != null) {
            country = NormalizationUtils.cleanText(flag.hasAttr("title") ? flag.attr("title") : flag.attr("alt"));
        } else {
            Element countryElement = document.selectFirst(".team-country");
            country = countryElement == null ? null : NormalizationUtils.cleanText(countryElement.text());
        }

        Integer worldRank = null;
        Element rank = document.selectFirst(".profile-team-stat .right");
        if (rank != null) {
            worldRank = NormalizationUtils.parseInteger(rank.text());
            if (worldRank == null) {
                emptyFields.add("worldRank");
            }
        }

        List<ExtractedRecord> records = new ArrayList<>();
        List<EntityRef> references = new ArrayList<>();
        records.add(new TeamRecord(teamId, name, country, worldRank, emptyFields));

        LocalDate observedOn = page.fetchedAt().atOffset(ZoneOffset.UTC).toLocalDate();
        Map<Long, String> roles = roles(document);
        Set<Long> seen = new HashSet<>();
        for (Element link : document.select(".bodyshot-team a[href*=/player/]")) {
            Long playerId = NormalizationUtils.idAfterSegment(link.attr("href"), "player");
            if (playerId == null || !seen.add(playerId)) {
                continue;
            }
            String nickname = nicknameOf(link);

            Map<String, Object> attributes = new LinkedHashMap<>();
            if (nickname != null) {
                attributes.put("nickname", nickname);
            }
            if (roles.containsKey(playerId)) {
                attributes.put("role", roles.get(playerId));
            }

            records.add(new PlayerRecord(playerId, nickname, null, null, null, teamId, null, Set.of()));
            records.add(AssociationRecord.teamPlayer(teamId, playerId, observedOn, attributes));
            references.add(new EntityRef(EntityKind.PLAYER, playerId, nickname));
        }

        return new Extraction(pageKind(), teamId, page.requestedUrl(), page.fetchedAt(), records, references);
    }

    private static String nicknameOf(Element link) {
        if (link.hasAttr("title")) {
            return NormalizationUtils.cleanText(link.attr("title"));
        }
        Element text = link.selectFirst(".text-ellipsis, .playerFlagName");
        return NormalizationUtils.cleanText(text != null ? text.text() : link.text());
    }

    /**
     * Player status ("Starter", "Benched", "Coach") from the players table, when shown.
     */
    private static Map<Long, String> roles(Document document) {
        Map<Long, String> roles = new HashMap<>();
        for (Element row : document.select(".players-table tbody tr")) {
            Element link = row.selectFirst("a[href*=/player/]");
            Element status = row.selectFirst(".player-status");
            if (link == null || status == null) {
                continue;
            }
            Long playerId = NormalizationUtils.idAfterSegment(link.attr("href"), "player");
            String role = NormalizationUtils.cleanText(status.text());
            if (playerId != null && role != null) {
                roles.put(playerId, role);
            }
        }
        return roles;
    }
}
