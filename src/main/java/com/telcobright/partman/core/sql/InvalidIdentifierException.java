package com.telcobright.partman.core.sql;

/**
 * Thrown when a table, column or partition name is rejected before any SQL is built from it.
 */
public class InvalidIdentifierException extends IllegalArgumentException {

    /**
     * Which rule the identifier broke.
     */
    public enum Reason {
        EMPTY,
        INVALID_CHARACTERS,
        TOO_LONG
    }

    private final Reason reason;
    private final String kind;

    public InvalidIdentifierException(Reason reason, String kind, String message) {
        super(message);
        this.reason = reason;
        this.kind = kind;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * What the identifier was meant to name, e.g. "table name".
     */
    public String getKind() {
        return kind;
    }
}
