package com.compliance.retention.graph;

import java.util.regex.Pattern;

/**
 * Validation for values that are spliced into Cypher text.
 * Category names become node labels and field names become property keys,
 * neither of which can be passed as query parameters.
 */
public final class InputSanitizer {

    /** Maximum allowed length for Cypher string values (JSON payloads included). */
    public static final int MAX_CYPHER_VALUE_LENGTH = 1_000_000;

    /** Maximum allowed length for labels and property keys. */
    public static final int MAX_IDENTIFIER_LENGTH = 128;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a label or property key.
     *
     * @throws IllegalArgumentException if the identifier could alter the query structure
     */
    public static String validateIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be null or blank");
        }
        if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    "Identifier exceeds maximum length of " + MAX_IDENTIFIER_LENGTH +
                            " characters (was " + identifier.length() + ")");
        }
        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(
                    "Identifier must contain only letters, digits and underscores, got: '" + identifier + "'");
        }
        return identifier;
    }

    /**
     * Enforces the maximum length of a string literal.
     */
    public static void sanitizeForCypher(String value) {
        if (value != null && value.length() > MAX_CYPHER_VALUE_LENGTH) {
            throw new IllegalArgumentException(
                    "Value exceeds maximum Cypher string length of " + MAX_CYPHER_VALUE_LENGTH +
                            " characters (was " + value.length() + ")");
        }
    }
}
