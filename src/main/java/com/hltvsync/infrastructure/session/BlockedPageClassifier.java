package com.hltvsync.infrastructure.session;

import com.hltvsync.infrastructure.config.ScraperProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a loaded page is an anti-bot challenge.
 *
 * A page counts as blocked only when at least {@code threshold} distinct signals match, so a
 * single coincidental phrase in real content does not discard it.
 */
public class BlockedPageClassifier {

    public static final int DEFAULT_THRESHOLD = 2;

    private final List<ChallengeSignal> signals;
    private final int threshold;

    public BlockedPageClassifier(List<ChallengeSignal> signals, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Threshold must be at least 1: " + threshold);
        }
        this.signals = List.copyOf(signals);
        this.threshold = threshold;
    }

    public static BlockedPageClassifier withDefaults() {
        return new BlockedPageClassifier(defaultSignals(), DEFAULT_THRESHOLD);
    }

    public static BlockedPageClassifier fromProperties(ScraperProperties.Classifier settings) {
        List<ChallengeSignal> configured = settings.getSignals().stream()
            .map(s -> new ChallengeSignal(
                s.getName(),
                ChallengeSignal.Type.valueOf(s.getType().trim().toUpperCase(Locale.ROOT)),
                s.getPattern()))
            .toList();
        return new BlockedPageClassifier(configured.isEmpty() ? defaultSignals() : configured, settings.getThreshold());
    }

    public static List<ChallengeSignal> defaultSignals() {
        return List.of(
            new ChallengeSignal("title:just-a-moment", ChallengeSignal.Type.TITLE_CONTAINS, "just a moment"),
            new ChallengeSignal("title:attention-required", ChallengeSignal.Type.TITLE_CONTAINS, "attention required!"),
            new ChallengeSignal("body:checking-browser", ChallengeSignal.Type.BODY_CONTAINS,
                "checking your browser before accessing"),
            new ChallengeSignal("body:cf-browser-verification", ChallengeSignal.Type.BODY_CONTAINS,
                "cf-browser-verification"),
            new ChallengeSignal("body:wait-while-we-check", ChallengeSignal.Type.BODY_CONTAINS,
                "wait while we check your browser"),
            new ChallengeSignal("body:enable-javascript-and-cookies", ChallengeSignal.Type.BODY_CONTAINS,
                "please enable javascript and cookies"),
            new ChallengeSignal("url:challenge-redirect", ChallengeSignal.Type.URL_MATCHES,
                "__cf_chl_(rt|jschl|captcha|managed)_tk__"),
            new ChallengeSignal("script:challenge-platform", ChallengeSignal.Type.SCRIPT_SRC_CONTAINS,
                "/cdn-cgi/challenge-platform/"));
    }

    public Classification classify(String html, String finalUrl) {
        String markup = html == null ? "" : html;
        Document document = Jsoup.parse(markup);
        List<String> scriptSources = new ArrayList<>();
        for (Element script : document.select("script[src]")) {
            scriptSources.add(script.attr("src").toLowerCase(Locale.ROOT));
        }
        ChallengeSignal.PageView view = new ChallengeSignal.PageView(
            document.title().toLowerCase(Locale.ROOT),
            markup.toLowerCase(Locale.ROOT),
            finalUrl,
            scriptSources);

        List<String> matched = signals.stream()
            .filter(signal -> signal.matches(view))
            .map(ChallengeSignal::name)
            .distinct()
            .toList();
        return new Classification(matched.size() >= threshold, matched);
    }

    public record Classification(boolean blocked, List<String> matchedSignals) {
    }
}
