package com.datasync.personconsumer.util;

/**
 * Checks identifiers that are concatenated into SQL text rather than bound as parameters.
 */
public final class SqlIdentifiers {

    public static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final String IDENTIFIER_PATTERN = "^[a-zA-Z_][a-zA-Z0-9_]*$";

    private SqlIdentifiers() {
    }

    /**
     * @param identifier     the identifier to check
     * @param identifierType used in error messages ("table", "column")
     * @return the trimmed identifier
     * @throws IllegalArgumentException if the identifier is empty, too long or not a plain identifier
     */
    public static String validate(String identifier, String identifierType) {
        if (identifier == null || identifier.trim().isEmpty()) {
            throw new IllegalArgumentException(identifierType + " name cannot be null or empty");
        }

        String trimmed = identifier.trim();

        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                String.format("%s name '%s' exceeds maximum length of %d characters (length: %d)",
                    identifierType, trimmed, MAX_IDENTIFIER_LENGTH, trimmed.length()));
        }

        if (!trimmed.matches(IDENTIFIER_PATTERN)) {
            throw new IllegalArgumentException(
                String.format("Invalid %s name: '%s'. Must start with letter or underscore, " +
                    "followed by alphanumeric characters or underscores only.",
                    identifierType, trimmed));
        }

        return trimmed;
    }
}
