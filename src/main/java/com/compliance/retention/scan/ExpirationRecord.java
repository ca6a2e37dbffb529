package com.compliance.retention.scan;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Expired records found in one category by a scan.
 *
 * @param category               the data category
 * @param expiredCount           records at or past their retention period
 * @param oldestRecordTimestamp  creation time of the oldest expired record
 * @param newestExpiredTimestamp creation time of the newest expired record
 * @param retentionPeriod        the period the scan applied
 */
public record ExpirationRecord(
        String category,
        long expiredCount,
        Instant oldestRecordTimestamp,
        Instant newestExpiredTimestamp,
        Duration retentionPeriod
) {
    public ExpirationRecord {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(retentionPeriod, "retentionPeriod is required");
        if (expiredCount < 0) {
            throw new IllegalArgumentException("expiredCount must be >= 0");
        }
    }

    /**
     * Records created at or before the returned instant are expired.
     */
    public Instant cutoff(Instant now) {
        return now.minus(retentionPeriod);
    }
}
