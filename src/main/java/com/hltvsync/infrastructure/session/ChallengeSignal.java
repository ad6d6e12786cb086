package com.hltvsync.infrastructure.session;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One strong indicator of an anti-bot challenge page.
 */
public record ChallengeSignal(String name, Type type, String pattern) {

    public enum Type {
        /** Case-insensitive substring of the document title. */
        TITLE_CONTAINS,
        /** Case-insensitive substring of the raw markup. */
        BODY_CONTAINS,
        /** Regular expression found in the final url, for challenge redirects. */
        URL_MATCHES,
        /** Case-insensitive substring of any script src. */
        SCRIPT_SRC_CONTAINS
    }

    public ChallengeSignal {
        if (name == null || type == null || pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Challenge signal needs a name, a type and a pattern");
        }
    }

    boolean matches(PageView page) {
        String needle = pattern.toLowerCase(Locale.ROOT);
        return switch (type) {
            case TITLE_CONTAINS -> page.title().contains(needle);
            case BODY_CONTAINS -> page.body().contains(needle);
            case URL_MATCHES -> page.url() != null && Pattern.compile(pattern).matcher(page.url()).find();
            case SCRIPT_SRC_CONTAINS -> page.scriptSources().stream().anyMatch(src -> src.contains(needle));
        };
    }

    /**
     * Lower-cased view of a page as the signals see it.
     */
    record PageView(String title, String body, String url, List<String> scriptSources) {
    }
}
