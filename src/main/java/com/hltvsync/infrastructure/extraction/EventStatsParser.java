package com.hltvsync.infrastructure.extraction;

import com.hltvsync.domain.exception.ExtractionException;
import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.EntityRef;
import com.hltvsync.domain.model.EventStatRecord;
import com.hltvsync.domain.model.ExtractedRecord;
import com.hltvsync.domain.model.Extraction;
import com.hltvsync.domain.model.PageContent;
import com.hltvsync.domain.model.PageKind;
import com.hltvsync.domain.model.PlayerRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-player statistics table of an event. Columns are located by their header, falling back
 * to the usual Player | Maps | Rating | K/D layout.
 */
@Component
public class EventStatsParser implements PageParser {

    @Override
    public PageKind pageKind() {
        return PageKind.EVENT_STATS;
    }

    @Override
    public Extraction parse(PageContent page) throws ExtractionException {
        Document document = Jsoup.parse(page.html(), page.finalUrl() == null ? "" : page.finalUrl());
        long eventId = PageIdentity.verify(eventIdOf(page), page);

        Element table = document.selectFirst(".stats-table");
        if (table == null) {
            throw new ExtractionException(pageKind(), page.requestedUrl(), "stats table missing");
        }
        Columns columns = Columns.of(table.select("thead th"));

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
            Elements cells = row.select("td");

            records.add(PlayerRecord.stub(playerId, nickname));
            records.add(new EventStatRecord(
                eventId,
                playerId,
                nickname,
                NormalizationUtils.parseDecimal(cell(cells, columns.rating())),
                NormalizationUtils.parseInteger(cell(cells, columns.maps())),
                NormalizationUtils.parseDecimal(cell(cells, columns.kdRatio())),
                Set.of()));
            references.add(new EntityRef(EntityKind.PLAYER, playerId, nickname));
        }

        return new Extraction(pageKind(), eventId, page.requestedUrl(), page.fetchedAt(), records, references);
    }

    /**
     * The stats page is addressed either as /stats/events/{id}/... or /stats?event={id}.
     */
    private long eventIdOf(PageContent page) throws ExtractionException {
        for (String url : new String[]{page.finalUrl(), page.requestedUrl()}) {
            Long id = NormalizationUtils.queryParam(url, "event");
            if (id == null) {
                id = NormalizationUtils.idAfterSegment(url, "events");
            }
            if (id != null) {
                return id;
            }
        }
        throw new ExtractionException(pageKind(), page.requestedUrl(), "event id missing from stats url");
    }

    private static String cell(Elements cells, int index) {
        return index >= 0 && index < cells.size() ? cells.get(index).text() : null;
    }

    private record Columns(int maps, int rating, int kdRatio) {

        static Columns of(Elements headers) {
            int maps = -1;
            int rating = -1;
            int kdRatio = -1;
            for (int i = 0; i < headers.size(); i++) {
                String label = NormalizationUtils.normalizeText(headers.get(i).text());
                if (label.equals("MAPS")) {
                    maps = i;
                } else if (label.startsWith("RATING")) {
                    rating = i;
                } else if (label.equals("K_D") || label.equals("KD") || label.equals("K_D_RATIO")) {
                    kdRatio = i;
                }
            }
            if (maps < 0 && rating < 0 && kdRatio < 0) {
                return new Columns(1, 2, 3);
            }
            return new Columns(maps, rating, kdRatio);
        }
    }
}
