package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.PlayerRecord;
import com.hltvsync.domain.model.PlayerStats;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Player statistics profile: identity, current team and career aggregates.
 */
@Component
public class PlayerProfileParser implements PageParser {

    /** "Oleksandr 's1mple' Kostyliev", optionally followed by the site suffix. */
    private static final Pattern FULL_NAME =
        Pattern.compile("^(.*?)\\s*'([^']+)'\\s*(.*?)(?:\\s+(?:Counter-Strike|Stats|\\||-).*)?$");

    @Override
    public PageKind pageKind() {
        return PageKind.PLAYER_PROFILE;
    }

    @Override
    public Extraction parse(PageContent page) throws ExtractionException {
        Document document = Jsoup.parse(page.html(), page.finalUrl() == null ? "" : page.finalUrl());
        long playerId = PageIdentity.require(document, page, "players", "player");
        Set<String> emptyFields = new HashSet<>();

        String nickname = text(document.selectFirst(".summaryNickname, .player-summary-stat-box-left-nickname"));
        String realName = null;
        Matcher fullName = FULL_NAME.matcher(document.title().trim());
        if (fullName.matches()) {
            if (nickname == null) {
                nickname = NormalizationUtils.cleanText(fullName.group(2));
            }
            realName = NormalizationUtils.cleanText(fullName.group(1) + " " + fullName.group(3));
        }

        String country = null;
        Element flag = document.selectFirst(".player-summary-stat-box-left-flag .flag, .summaryRealname .flag");
        if (flag != null) {
            country = NormalizationUtils.cleanText(flag.hasAttr("title") ? flag.attr("title") : flag.attr("alt"));
        }

        Integer age = NormalizationUtils.parseInteger(
            text(document.selectFirst(".player-summary-stat-box-left-player-age, .summaryPlayerAge")));

        Long currentTeamId = null;
        Element team = document.selectFirst(".playerTeam, .player-summary-stat-box-left-team");
        if (team != null) {
            Element teamLink = team.selectFirst("a[href*=/team/]");
            currentTeamId = teamLink == null
                ? null
                : NormalizationUtils.idAfterSegment(teamLink.attr("href"), "team", "teams");
            if (currentTeamId == null) {
                emptyFields.add("currentTeamId");
            }
        }

        PlayerStats stats = statsOf(document, page);
        PlayerRecord record = new PlayerRecord(
            playerId, nickname, realName, country, age, currentTeamId, stats.hasAnyValue() ? stats : null, emptyFields);
        return new Extraction(pageKind(), playerId, page.requestedUrl(), page.fetchedAt(), List.of(record), List.of());
    }

    private static PlayerStats statsOf(Document document, PageContent page) {
        Map<String, String> values = new HashMap<>();
        for (Element row : document.select(".stats-row")) {
            Elements spans = row.select("> span");
            if (spans.size() >= 2) {
                values.putIfAbsent(NormalizationUtils.normalizeText(spans.get(0).text()), spans.get(1).text());
            }
        }
        for (Element box : document.select(".player-summary-stat-box-data-wrapper")) {
            Element value = box.selectFirst(".player-summary-stat-box-data");
            Element label = box.selectFirst(".player-summary-stat-box-data-text");
            if (value != null && label != null) {
                values.putIfAbsent(NormalizationUtils.normalizeText(label.text()), value.text());
            }
        }
        Element rating = document.selectFirst(".player-summary-stat-box-rating-data-text");

        Double ratingValue = rating != null
            ? NormalizationUtils.parseDecimal(rating.text())
            : NormalizationUtils.parseDecimal(first(values, "RATING_2_1", "RATING_2_0", "RATING_1_0", "RATING"));

        return new PlayerStats(
            NormalizationUtils.parseInteger(first(values, "TOTAL_KILLS", "KILLS")),
            NormalizationUtils.parseInteger(first(values, "DEATHS", "TOTAL_DEATHS")),
            NormalizationUtils.parseDecimal(first(values, "K_D_RATIO", "K_D")),
            ratingValue,
            NormalizationUtils.parseDecimal(first(values, "KAST")),
            NormalizationUtils.parseDecimal(first(values, "DAMAGE_ROUND", "ADR")),
            NormalizationUtils.parseDecimal(first(values, "KILLS_ROUND", "KPR")),
            NormalizationUtils.parseDecimal(first(values, "IMPACT")),
            NormalizationUtils.parseDecimal(first(values, "HEADSHOT", "HEADSHOT_PERCENTAGE")),
            NormalizationUtils.parseInteger(first(values, "MAPS_PLAYED")),
            NormalizationUtils.parseInteger(first(values, "ROUNDS_PLAYED")),
            page.fetchedAt());
    }

    private static String first(Map<String, String> values, String... labels) {
        for (String label : labels) {
            String value = values.get(label);
            if (value != null && !NormalizationUtils.isPlaceholder(value)) {
                return value;
            }
        }
        return null;
    }

    private static String text(Element element) {
        return element == null ? null : NormalizationUtils.cleanText(element.text());
    }
}
