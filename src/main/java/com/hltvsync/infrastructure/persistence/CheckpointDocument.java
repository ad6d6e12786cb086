package com.hltvsync.infrastructure.persistence;

import com.hltvsync.domain.model.EntityKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored form of a sync checkpoint. Units are kept as their string keys.
 */
@Document(collection = "sync_checkpoints")
public class CheckpointDocument {

    @Id
    private String id;
    private String scopeKey;
    private EntityKind kind;
    private Long specificId;
    private Integer unseenCount;
    private boolean fullStats;
    private int maxEvents;
    private int maxTeams;
    private int maxPlayers;
    private List<String> planned = new ArrayList<>();
    private List<String> completed = new ArrayList<>();
    private List<FailureEntry> failures = new ArrayList<>();
    private boolean open;
    private String finalState;
    private Instant openedAt;
    private Instant updatedAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    public void setScopeKey(String scopeKey) {
        this.scopeKey = scopeKey;
    }

    public EntityKind getKind() {
        return kind;
    }

    public void setKind(EntityKind kind) {
        this.kind = kind;
    }

    public Long getSpecificId() {
        return specificId;
    }

    public void setSpecificId(Long specificId) {
        this.specificId = specificId;
    }

    public Integer getUnseenCount() {
        return unseenCount;
    }

    public void setUnseenCount(Integer unseenCount) {
        this.unseenCount = unseenCount;
    }

    public boolean isFullStats() {
        return fullStats;
    }

    public void setFullStats(boolean fullStats) {
        this.fullStats = fullStats;
    }

    public int getMaxEvents() {
        return maxEvents;
    }

    public void setMaxEvents(int maxEvents) {
        this.maxEvents = maxEvents;
    }

    public int getMaxTeams() {
        return maxTeams;
    }

    public void setMaxTeams(int maxTeams) {
        this.maxTeams = maxTeams;
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }

    public void setMaxPlayers(int maxPlayers) {
        this.maxPlayers = maxPlayers;
    }

    public List<String> getPlanned() {
        return planned;
    }

    public void setPlanned(List<String> planned) {
        this.planned = planned;
    }

    public List<String> getCompleted() {
        return completed;
    }

    public void setCompleted(List<String> completed) {
        this.completed = completed;
    }

    public List<FailureEntry> getFailures() {
        return failures;
    }

    public void setFailures(List<FailureEntry> failures) {
        this.failures = failures;
    }

    public boolean isOpen() {
        return open;
    }

    public void setOpen(boolean open) {
        this.open = open;
    }

    public String getFinalState() {
        return finalState;
    }

    public void setFinalState(String finalState) {
        this.finalState = finalState;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public void setOpenedAt(Instant openedAt) {
        this.openedAt = openedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * One recorded unit failure.
     */
    public static class FailureEntry {
        private String unitKey;
        private String pageKind;
        private String url;
        private String type;
        private int attempts;
        private List<String> lastSignals = new ArrayList<>();
        private String message;
        private Instant failedAt;

        public String getUnitKey() {
            return unitKey;
        }

        public void setUnitKey(String unitKey) {
            this.unitKey = unitKey;
        }

        public String getPageKind() {
            return pageKind;
        }

        public void setPageKind(String pageKind) {
            this.pageKind = pageKind;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public int getAttempts() {
            return attempts;
        }

        public void setAttempts(int attempts) {
            this.attempts = attempts;
        }

        public List<String> getLastSignals() {
            return lastSignals;
        }

        public void setLastSignals(List<String> lastSignals) {
            this.lastSignals = lastSignals;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public Instant getFailedAt() {
            return failedAt;
        }

        public void setFailedAt(Instant failedAt) {
            this.failedAt = failedAt;
        }
    }
}
