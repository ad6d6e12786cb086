package com.hltvsync.infrastructure.extraction;

import java.text.Normalizer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text and number normalization for scraped markup.
 */
public class NormalizationUtils {

    private static final Pattern QUERY_PARAM = Pattern.compile("[?&]([A-Za-z]+)=(\\d+)");
    private static final Pattern INTEGER = Pattern.compile("-?\\d[\\d,]*");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d[\\d,]*(\\.\\d+)?");

    /**
     * Normalizes text into a matching key.
     *
     * Rules:
     * 1. Remove accents (Fnàtic -> FNATIC)
     * 2. Convert to uppercase
     * 3. Replace non-alphanumeric with underscore
     * 4. Collapse multiple underscores
     * 5. Remove leading/trailing underscores
     */
    public static String normalizeText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return "";
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFD);
        normalized = normalized.replaceAll("\\p{M}", "");
        normalized = normalized.toUpperCase();
        normalized = normalized.replaceAll("[^A-Z0-9]+", "_");
        normalized = normalized.replaceAll("_+", "_");
        normalized = normalized.replaceAll("^_+|_+$", "");

        return normalized;
    }

    /**
     * Trims and collapses whitespace. Blank text becomes null.
     */
    public static String cleanText(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * True for the placeholders the site shows instead of a value ("-", "TBA", "N/A").
     */
    public static boolean isPlaceholder(String text) {
        String cleaned = cleanText(text);
        if (cleaned == null) {
            return false;
        }
        String key = normalizeText(cleaned);
        return key.isEmpty() || key.equals("TBA") || key.equals("TBD") || key.equals("N_A");
    }

    /**
     * First integer in the text, ignoring thousands separators: "#12" -> 12, "1,234 kills" -> 1234.
     */
    public static Integer parseInteger(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = INTEGER.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.valueOf(matcher.group().replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * First decimal in the text: "1.23" -> 1.23, "45.6%" -> 45.6.
     */
    public static Double parseDecimal(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = DECIMAL.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return Double.valueOf(matcher.group().replace(",", ""));
    }

    /**
     * Id following one of the path segments: ("/team/9565/vitality", "team") -> 9565.
     */
    public static Long idAfterSegment(String url, String... segments) {
        if (url == null) {
            return null;
        }
        for (String segment : segments) {
            Matcher matcher = Pattern.compile("/" + Pattern.quote(segment) + "/(\\d+)(?:[/?#]|$)").matcher(url);
            if (matcher.find()) {
                return Long.valueOf(matcher.group(1));
            }
        }
        return null;
    }

    /**
     * Numeric query parameter: ("/stats?event=8040", "event") -> 8040.
     */
    public static Long queryParam(String url, String name) {
        if (url == null) {
            return null;
        }
        Matcher matcher = QUERY_PARAM.matcher(url);
        while (matcher.find()) {
            if (matcher.group(1).equals(name)) {
                return Long.valueOf(matcher.group(2));
            }
        }
        return null;
    }

    /**
     * UTC date of an epoch-millis attribute such as {@code data-unix}.
     */
    public static LocalDate utcDate(String epochMillis) {
        if (epochMillis == null || epochMillis.isBlank()) {
            return null;
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(epochMillis.trim())).atOffset(ZoneOffset.UTC).toLocalDate();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
