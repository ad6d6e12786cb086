package com.hltvsync.infrastructure.config;

import com.hltvsync.domain.model.EntityKind;
import com.hltvsync.domain.model.PageKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Engine settings bound from {@code hltv.*}. Every value has a default, so the engine runs
 * without any YAML.
 */
@Component
@ConfigurationProperties(prefix = "hltv")
public class ScraperProperties {

    private Session session = new Session();
    private Retry retry = new Retry();
    private Classifier classifier = new Classifier();
    private Workers workers = new Workers();
    private Snapshots snapshots = new Snapshots();
    private Map<PageKind, PageSettings> pages = new EnumMap<>(PageKind.class);

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Workers getWorkers() {
        return workers;
    }

    public void setWorkers(Workers workers) {
        this.workers = workers;
    }

    public Snapshots getSnapshots() {
        return snapshots;
    }

    public void setSnapshots(Snapshots snapshots) {
        this.snapshots = snapshots;
    }

    public Map<PageKind, PageSettings> getPages() {
        return pages;
    }

    public void setPages(Map<PageKind, PageSettings> pages) {
        this.pages = pages;
    }

    public static class Session {
        private int maxSessions = 2;
        private int maxNavigationsPerSession = 25;
        private Duration minNavigationDelay = Duration.ofMillis(2500);
        private Duration navigationJitter = Duration.ofMillis(1500);
        private Duration navigationTimeout = Duration.ofSeconds(30);
        private boolean headless = true;

        public int getMaxSessions() {
            return maxSessions;
        }

        public void setMaxSessions(int maxSessions) {
            this.maxSessions = maxSessions;
        }

        public int getMaxNavigationsPerSession() {
            return maxNavigationsPerSession;
        }

        public void setMaxNavigationsPerSession(int maxNavigationsPerSession) {
            this.maxNavigationsPerSession = maxNavigationsPerSession;
        }

        public Duration getMinNavigationDelay() {
            return minNavigationDelay;
        }

        public void setMinNavigationDelay(Duration minNavigationDelay) {
            this.minNavigationDelay = minNavigationDelay;
        }

        public Duration getNavigationJitter() {
            return navigationJitter;
        }

        public void setNavigationJitter(Duration navigationJitter) {
            this.navigationJitter = navigationJitter;
        }

        public Duration getNavigationTimeout() {
            return navigationTimeout;
        }

        public void setNavigationTimeout(Duration navigationTimeout) {
            this.navigationTimeout = navigationTimeout;
        }

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    /**
     * Blocked-page detection. An empty signal list means the built-in signals are used.
     */
    public static class Classifier {
        private int threshold = 2;
        private List<SignalSettings> signals = new ArrayList<>();

        public int getThreshold() {
            return threshold;
        }

        public void setThreshold(int threshold) {
            this.threshold = threshold;
        }

        public List<SignalSettings> getSignals() {
            return signals;
        }

        public void setSignals(List<SignalSettings> signals) {
            this.signals = signals;
        }
    }

    public static class SignalSettings {
        private String name;
        private String type;
        private String pattern;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }
    }

    /**
     * Worker threads per entity kind.
     */
    public static class Workers {
        private int events = 1;
        private int teams = 1;
        private int players = 1;

        public int getEvents() {
            return events;
        }

        public void setEvents(int events) {
            this.events = events;
        }

        public int getTeams() {
            return teams;
        }

        public void setTeams(int teams) {
            this.teams = teams;
        }

        public int getPlayers() {
            return players;
        }

        public void setPlayers(int players) {
            this.players = players;
        }

        public int sizeFor(EntityKind kind) {
            int size = switch (kind) {
                case EVENT -> events;
                case TEAM -> teams;
                case PLAYER -> players;
            };
            return Math.max(1, size);
        }
    }

    public static class Snapshots {
        private boolean enabled = true;
        private String directory = "snapshots";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    /**
     * Per page kind overrides. Null values fall back to the built-in page catalog.
     */
    public static class PageSettings {
        private String urlTemplate;
        private String readySelector;
        private String renderer;
        private Duration readyTimeout;

        public String getUrlTemplate() {
            return urlTemplate;
        }

        public void setUrlTemplate(String urlTemplate) {
            this.urlTemplate = urlTemplate;
        }

        public String getReadySelector() {
            return readySelector;
        }

        public void setReadySelector(String readySelector) {
            this.readySelector = readySelector;
        }

        public String getRenderer() {
            return renderer;
        }

        public void setRenderer(String renderer) {
            this.renderer = renderer;
        }

        public Duration getReadyTimeout() {
            return readyTimeout;
        }

        public void setReadyTimeout(Duration readyTimeout) {
            this.readyTimeout = readyTimeout;
        }
    }
}
