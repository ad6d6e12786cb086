package com.hltvsync.infrastructure.session;

import com.hltvsync.infrastructure.config.ScraperProperties;
import com.hltvsync.support.ScriptedPageDriver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockedPageClassifierTest {

    private final BlockedPageClassifier classifier = BlockedPageClassifier.withDefaults();

    @Test
    void testChallengePageIsBlocked() {
        BlockedPageClassifier.Classification result =
            classifier.classify(ScriptedPageDriver.CHALLENGE_HTML, "https://www.hltv.org/events/8040/event");

        assertTrue(result.blocked());
        assertTrue(result.matchedSignals().contains("title:just-a-moment"));
        assertTrue(result.matchedSignals().contains("body:checking-browser"));
        assertTrue(result.matchedSignals().contains("script:challenge-platform"));
    }

    @Test
    void testSingleSignalIsNotEnough() {
        // A news post quoting the challenge title
        String html = "<html><head><title>Just a moment of silence for FaZe | HLTV.org</title></head>"
            + "<body><div class=\"newsline\">article</div></body></html>";

        BlockedPageClassifier.Classification result = classifier.classify(html, "https://www.hltv.org/news/1/x");

        assertFalse(result.blocked());
        assertEquals(List.of("title:just-a-moment"), result.matchedSignals());
    }

    @Test
    void testRedirectUrlCountsAsSignal() {
        String html = "<html><head><title>hltv.org</title></head>"
            + "<body><noscript>Please enable JavaScript and cookies to continue</noscript></body></html>";

        BlockedPageClassifier.Classification result = classifier.classify(html,
            "https://www.hltv.org/events/8040/event?__cf_chl_rt_tk__=abc123");

        assertTrue(result.blocked());
        assertEquals(List.of("body:enable-javascript-and-cookies", "url:challenge-redirect"),
            result.matchedSignals());
    }

    @Test
    void testRegularPageIsNotBlocked() {
        String html = "<html><head><title>IEM Katowice 2024 | HLTV.org</title>"
            + "<script src=\"https://www.hltv.org/scripts/app.js\"></script></head>"
            + "<body><div class=\"event-hub-title\">IEM Katowice 2024</div></body></html>";

        BlockedPageClassifier.Classification result = classifier.classify(html, "https://www.hltv.org/events/7148/event");

        assertFalse(result.blocked());
        assertTrue(result.matchedSignals().isEmpty());
    }

    @Test
    void testEverySignalCombination() {
        List<ChallengeSignal> signals = BlockedPageClassifier.defaultSignals();

        for (int mask = 0; mask < (1 << signals.size()); mask++) {
            List<ChallengeSignal> present = new ArrayList<>();
            for (int i = 0; i < signals.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    present.add(signals.get(i));
                }
            }
            List<String> names = present.stream().map(ChallengeSignal::name).toList();

            BlockedPageClassifier.Classification result =
                classifier.classify(pageWith(present), urlWith(present));

            assertEquals(names, result.matchedSignals(), "signals " + names);
            assertEquals(names.size() >= 2, result.blocked(), "signals " + names);
        }
    }

    @Test
    void testEmptyPageIsNotBlocked() {
        assertFalse(classifier.classify(null, null).blocked());
    }

    @Test
    void testConfiguredSignalsReplaceDefaults() {
        ScraperProperties.SignalSettings signal = new ScraperProperties.SignalSettings();
        signal.setName("body:access-denied");
        signal.setType("body_contains");
        signal.setPattern("Access denied");
        ScraperProperties.Classifier settings = new ScraperProperties.Classifier();
        settings.setThreshold(1);
        settings.setSignals(List.of(signal));

        BlockedPageClassifier configured = BlockedPageClassifier.fromProperties(settings);

        assertTrue(configured.classify("<html><body>ACCESS DENIED</body></html>", null).blocked());
        assertFalse(configured.classify(ScriptedPageDriver.CHALLENGE_HTML, null).blocked());
    }

    @Test
    void testThresholdMustBePositive() {
        assertThrows(IllegalArgumentException.class,
            () -> new BlockedPageClassifier(BlockedPageClassifier.defaultSignals(), 0));
    }

    private static String pageWith(List<ChallengeSignal> signals) {
        StringBuilder title = new StringBuilder();
        StringBuilder head = new StringBuilder();
        StringBuilder body = new StringBuilder("<div class=\"event-hub-title\">IEM Katowice 2024</div>");
        for (ChallengeSignal signal : signals) {
            switch (signal.type()) {
                case TITLE_CONTAINS -> title.append(signal.pattern()).append(' ');
                case BODY_CONTAINS -> body.append("<p>").append(signal.pattern()).append("</p>");
                case SCRIPT_SRC_CONTAINS -> head.append("<script src=\"").append(signal.pattern())
                    .append("h/b/orchestrate/jsch/v1\"></script>");
                default -> {
                    // the url carries it
                }
            }
        }
        if (title.length() == 0) {
            title.append("IEM Katowice 2024 | HLTV.org");
        }
        return "<html><head><title>" + title + "</title>" + head + "</head><body>" + body + "</body></html>";
    }

    private static String urlWith(List<ChallengeSignal> signals) {
        boolean redirected = signals.stream().anyMatch(signal -> signal.type() == ChallengeSignal.Type.URL_MATCHES);
        return "https://www.hltv.org/events/7148/event" + (redirected ? "?__cf_chl_rt_tk__=abc123" : "");
    }
}
