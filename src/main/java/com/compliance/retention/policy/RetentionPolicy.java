package com.compliance.retention.policy;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Retention rule for a single data category: records older than
 * {@code retentionPeriod} become deletion candidates.
 *
 * @param category        the data category (also the store-side table or label name)
 * @param retentionPeriod maximum age a record may reach before it expires
 */
public record RetentionPolicy(String category, Duration retentionPeriod) {

    /** Categories double as store identifiers, so only plain identifiers are accepted. */
    static final Pattern CATEGORY_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public RetentionPolicy {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(retentionPeriod, "retentionPeriod is required");
        if (!CATEGORY_PATTERN.matcher(category).matches()) {
            throw new IllegalArgumentException(
                    "category must be an identifier of letters, digits and underscores, got: '" + category + "'");
        }
        if (retentionPeriod.isNegative() || retentionPeriod.isZero()) {
            throw new IllegalArgumentException("retentionPeriod must be positive for category " + category);
        }
    }

    public static RetentionPolicy ofDays(String category, long days) {
        return new RetentionPolicy(category, Duration.ofDays(days));
    }

    /**
     * Returns the retention period in whole days, as recorded in manifests.
     */
    public long retentionDays() {
        return retentionPeriod.toDays();
    }
}
