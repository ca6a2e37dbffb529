package com.compliance.retention.anonymize;

import java.util.List;
import java.util.Objects;

/**
 * Result of anonymizing one category.
 *
 * @param category          the data category
 * @param success           whether every expired record was rewritten
 * @param fieldsProcessed   the fields the profile covers
 * @param recordsAnonymized records rewritten by this run; previously anonymized records are not counted
 * @param error             failure description when unsuccessful
 */
public record AnonymizationOutcome(
        String category,
        boolean success,
        List<String> fieldsProcessed,
        long recordsAnonymized,
        String error
) {
    public AnonymizationOutcome {
        Objects.requireNonNull(category, "category is required");
        fieldsProcessed = fieldsProcessed != null ? List.copyOf(fieldsProcessed) : List.of();
        if (recordsAnonymized < 0) {
            throw new IllegalArgumentException("recordsAnonymized must be >= 0");
        }
        if (!success && error == null) {
            throw new IllegalArgumentException("a failed outcome needs an error");
        }
    }

    public static AnonymizationOutcome succeeded(String category, List<String> fields, long recordsAnonymized) {
        return new AnonymizationOutcome(category, true, fields, recordsAnonymized, null);
    }

    public static AnonymizationOutcome failed(String category, List<String> fields, String error) {
        return new AnonymizationOutcome(category, false, fields, 0, error);
    }
}
