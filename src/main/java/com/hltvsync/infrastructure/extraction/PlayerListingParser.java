package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.EntityRef;
import com.hltvsync.domain.model.ExtractedRecord;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.PlayerRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Player ratings table, in table order.
 */
@Component
public class PlayerListingParser implements PageParser {

    @Override
    public PageKind pageKind() {
        return PageKind.PLAYER_LISTING;
    }

    @Override
    public Extraction parse(PageContent page) throws ExtractionException {
        Document document = Jsoup.parse(page.html(), page.finalUrl() == null ? "" : page.finalUrl());
        Element table = document.selectFirst(".player-ratings-table");
        if (table == null) {
            throw new ExtractionException(pageKind(), page.requestedUrl(), "player ratings table missing");
        }

        List<ExtractedRecord> records = new ArrayList<>();
        List<EntityRef> references = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (Element row : table.select("tbody tr")) {
            Element link = row.selectFirst("td.playerCol a");
            Long playerId = link == null ? null : NormalizationUtils.idAfterSegment(link.attr("href"), "players", "player");
            if (playerId == null || !seen.add(playerId)) {
                continue;
            }
            String nickname = NormalizationUtils.cleanText(link.text());
            Element flag = row.selectFirst("td.playerCol .flag");
            String country = flag == null ? null : NormalizationUtils.cleanText(flag.attr("title"));

            records.add(new PlayerRecord(playerId, nickname, null, country, null, null, null, Set.of()));
            references.add(new EntityRef(EntityKind.PLAYER, playerId, nickname));
        }
        return new Extraction(pageKind(), null, page.requestedUrl(), page.fetchedAt(), records, references);
    }
}
