package com.telcobright.partman.core.sql;

import java.util.regex.Pattern;

/**
 * Allow-list validation and backtick quoting for SQL identifiers.
 * <p>
 * Identifiers cannot be bound as statement parameters, so every table, column and
 * partition name that ends up inside DDL text must come out of {@link #escape(String, String)}.
 */
public final class IdentifierValidator {

    public static final int MAX_LENGTH = 64;

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

    private IdentifierValidator() {
    }

    public static void validate(String identifier) {
        validate(identifier, "identifier");
    }

    /**
     * @param identifier name to check
     * @param kind what the name refers to, used in the error message ("table name", "partition name")
     * @throws InvalidIdentifierException if the name is empty, uses characters outside
     *         {@code [A-Za-z0-9_-]} or is longer than {@value #MAX_LENGTH} characters
     */
    public static void validate(String identifier, String kind) {
        if (identifier == null || identifier.isEmpty()) {
            throw new InvalidIdentifierException(InvalidIdentifierException.Reason.EMPTY, kind,
                "Invalid " + kind + ": must not be empty");
        }
        if (!VALID_PATTERN.matcher(identifier).matches()) {
            throw new InvalidIdentifierException(InvalidIdentifierException.Reason.INVALID_CHARACTERS, kind,
                String.format("Invalid %s: \"%s\". Only alphanumeric, underscore, and hyphen allowed.",
                    kind, identifier));
        }
        if (identifier.length() > MAX_LENGTH) {
            throw new InvalidIdentifierException(InvalidIdentifierException.Reason.TOO_LONG, kind,
                String.format("Invalid %s: name too long (%d characters). Maximum %d characters.",
                    kind, identifier.length(), MAX_LENGTH));
        }
    }

    public static boolean isValid(String identifier) {
        try {
            validate(identifier);
            return true;
        } catch (InvalidIdentifierException e) {
            return false;
        }
    }

    public static String escape(String identifier) {
        return escape(identifier, "identifier");
    }

    /**
     * Validates the identifier and wraps it in backticks, doubling embedded backticks.
     */
    public static String escape(String identifier, String kind) {
        validate(identifier, kind);
        return "`" + identifier.replace("`", "``") + "`";
    }
}
