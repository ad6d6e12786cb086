package com.hltvsync.domain.exception;

/**
 * Store failure. CONNECTIVITY fails the whole run, CONSTRAINT only the unit being reconciled.
 */
public class PersistenceException extends RuntimeException {

    public enum Kind {
        CONNECTIVITY,
        CONSTRAINT
    }

    private final Kind kind;

    public PersistenceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PersistenceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static PersistenceException constraint(String message) {
        return new PersistenceException(Kind.CONSTRAINT, message);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isConnectivity() {
        return kind == Kind.CONNECTIVITY;
    }
}
