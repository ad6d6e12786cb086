package com.hltvsync.domain.model;

/**
 * First-class associations between entities. The left side is the owning entity.
 */
public enum AssociationKind {
    EVENT_TEAM("eventId", "teamId"),
    TEAM_PLAYER("teamId", "playerId");

    private final String leftField;
    private final String rightField;

    AssociationKind(String leftField, String rightField) {
        this.leftField = leftField;
        this.rightField = rightField;
    }

    public String getLeftField() {
        return leftField;
    }

    public String getRightField() {
        return rightField;
    }
}
