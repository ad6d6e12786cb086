package com.hltvsync.infrastructure.session;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Browser identity presented by one session.
 */
public record FingerprintProfile(
        String userAgent,
        int viewportWidth,
        int viewportHeight,
        String locale,
        String timezoneId,
        int hardwareConcurrency,
        int deviceMemory,
        String platform) {

    private static final List<String> USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36");
    private static final int[][] VIEWPORTS = {{1920, 1080}, {1536, 864}, {1440, 900}, {1366, 768}, {1280, 800}};
    private static final List<String> LOCALES = List.of("en-US", "en-GB", "de-DE", "sv-SE", "pt-BR");
    private static final List<String> TIMEZONES = List.of(
        "Europe/Copenhagen", "Europe/Berlin", "Europe/London", "America/New_York", "America/Sao_Paulo");
    private static final int[] CORES = {4, 8, 12, 16};
    private static final int[] MEMORY_GB = {4, 8, 16};

    public static FingerprintProfile random(Random random) {
        String userAgent = USER_AGENTS.get(random.nextInt(USER_AGENTS.size()));
        int[] viewport = VIEWPORTS[random.nextInt(VIEWPORTS.length)];
        return new FingerprintProfile(
            userAgent,
            viewport[0],
            viewport[1],
            LOCALES.get(random.nextInt(LOCALES.size())),
            TIMEZONES.get(random.nextInt(TIMEZONES.size())),
            CORES[random.nextInt(CORES.length)],
            MEMORY_GB[random.nextInt(MEMORY_GB.length)],
            platformOf(userAgent));
    }

    public Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", userAgent);
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
        headers.put("Accept-Language", locale + "," + locale.substring(0, 2) + ";q=0.9");
        headers.put("Upgrade-Insecure-Requests", "1");
        return headers;
    }

    /**
     * Init script hiding automation markers and aligning navigator values with this profile.
     */
    public String stealthScript() {
        return String.format("""
            Object.defineProperty(navigator, 'webdriver', { get: () => undefined, configurable: true });
            delete navigator.__proto__.webdriver;
            window.chrome = window.chrome || { runtime: {} };
            Object.defineProperty(navigator, 'hardwareConcurrency', { get: () => %d });
            Object.defineProperty(navigator, 'deviceMemory', { get: () => %d });
            Object.defineProperty(navigator, 'platform', { get: () => '%s' });
            Object.defineProperty(navigator, 'languages', { get: () => ['%s', '%s'] });
            Object.defineProperty(navigator, 'plugins', { get: () => [1, 2, 3, 4, 5] });
            const originalQuery = window.navigator.permissions && window.navigator.permissions.query;
            if (originalQuery) {
                window.navigator.permissions.query = (parameters) => parameters.name === 'notifications'
                    ? Promise.resolve({ state: Notification.permission })
                    : originalQuery(parameters);
            }
            """,
            hardwareConcurrency, deviceMemory, platform, locale, locale.substring(0, 2));
    }

    private static String platformOf(String userAgent) {
        if (userAgent.contains("Windows")) {
            return "Win32";
        }
        if (userAgent.contains("Macintosh")) {
            return "MacIntel";
        }
        return "Linux x86_64";
    }
}
