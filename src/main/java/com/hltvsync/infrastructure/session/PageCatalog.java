package com.hltvsync.infrastructure.session;

import com.hltvsync.domain.model.PageKind;
import com.hltvsync.infrastructure.config.ScraperProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolved fetch settings for every page kind: built-in HLTV defaults overlaid with
 * {@code hltv.pages.*}.
 */
@Component
public class PageCatalog {

    private static final Duration DEFAULT_READY_TIMEOUT = Duration.ofSeconds(15);

    private final Map<PageKind, PageSpec> specs;

    public PageCatalog(ScraperProperties properties) {
        Map<PageKind, PageSpec> resolved = new EnumMap<>(PageKind.class);
        Map<PageKind, ScraperProperties.PageSettings> overrides = properties.getPages();
        defaults().forEach((kind, spec) -> {
            ScraperProperties.PageSettings override = overrides == null ? null : overrides.get(kind);
            resolved.put(kind, override == null ? spec : overlay(spec, override));
        });
        this.specs = Collections.unmodifiableMap(resolved);
    }

    public PageSpec specFor(PageKind kind) {
        return specs.get(kind);
    }

    public String urlFor(PageKind kind, Long externalId) {
        return specFor(kind).urlFor(externalId);
    }

    static Map<PageKind, PageSpec> defaults() {
        Map<PageKind, PageSpec> defaults = new EnumMap<>(PageKind.class);
        defaults.put(PageKind.EVENT_LISTING,
            browser("https://www.hltv.org/events", ".events-holder"));
        defaults.put(PageKind.TEAM_LISTING,
            browser("https://www.hltv.org/ranking/teams", ".ranking"));
        defaults.put(PageKind.PLAYER_LISTING,
            browser("https://www.hltv.org/stats/players", ".player-ratings-table"));
        defaults.put(PageKind.EVENT_OVERVIEW,
            browser("https://www.hltv.org/events/{id}/event", ".event-hub-title"));
        defaults.put(PageKind.EVENT_RESULTS,
            browser("https://www.hltv.org/events/{id}/event", ".event-hub-title"));
        defaults.put(PageKind.EVENT_STATS,
            browser("https://www.hltv.org/stats/events/{id}/event", ".stats-table"));
        defaults.put(PageKind.TEAM_ROSTER,
            browser("https://www.hltv.org/team/{id}/team", ".teamProfile"));
        defaults.put(PageKind.PLAYER_PROFILE,
            browser("https://www.hltv.org/stats/players/{id}/player", ".stats-row"));
        return defaults;
    }

    private static PageSpec browser(String urlTemplate, String readySelector) {
        return new PageSpec(urlTemplate, readySelector, Renderer.BROWSER, DEFAULT_READY_TIMEOUT);
    }

    private static PageSpec overlay(PageSpec spec, ScraperProperties.PageSettings override) {
        return new PageSpec(
            override.getUrlTemplate() != null ? override.getUrlTemplate() : spec.urlTemplate(),
            override.getReadySelector() != null ? override.getReadySelector() : spec.readySelector(),
            override.getRenderer() != null
                ? Renderer.valueOf(override.getRenderer().trim().toUpperCase(Locale.ROOT))
                : spec.renderer(),
            override.getReadyTimeout() != null ? override.getReadyTimeout() : spec.readyTimeout());
    }
}
