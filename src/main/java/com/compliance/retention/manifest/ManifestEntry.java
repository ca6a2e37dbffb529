package com.compliance.retention.manifest;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One category planned for deletion.
 *
 * @param category               the data category
 * @param recordsToDelete        expired records counted by the scan
 * @param retentionPeriod        the period the deletion cutoff derives from
 * @param oldestRecordTimestamp  oldest expired creation time, if known
 * @param newestExpiredTimestamp newest expired creation time, if known
 * @param anonymized             whether the category was anonymized in this cycle
 */
public record ManifestEntry(
        String category,
        long recordsToDelete,
        Duration retentionPeriod,
        Instant oldestRecordTimestamp,
        Instant newestExpiredTimestamp,
        boolean anonymized
) {
    public ManifestEntry {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(retentionPeriod, "retentionPeriod is required");
        if (recordsToDelete < 0) {
            throw new IllegalArgumentException("recordsToDelete must be >= 0");
        }
    }
}
