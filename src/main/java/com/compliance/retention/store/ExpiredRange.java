package com.compliance.retention.store;

import java.time.Instant;

/**
 * Expired-record statistics for one category.
 *
 * @param count  number of expired records
 * @param oldest creation time of the oldest expired record, or null when none
 * @param newest creation time of the newest expired record, or null when none
 */
public record ExpiredRange(long count, Instant oldest, Instant newest) {

    public ExpiredRange {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
    }

    public static ExpiredRange empty() {
        return new ExpiredRange(0, null, null);
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
