package com.compliance.retention.metrics;

import java.time.Duration;

/**
 * Records retention pipeline metrics.
 * The default {@link NoOpRetentionMetrics} does nothing, so the pipeline runs
 * without a metrics registry.
 */
public interface RetentionMetrics {

    void recordRunDuration(String status, Duration duration);

    void recordRecordsDeleted(String category, long count);

    void recordRecordsAnonymized(String category, long count);

    void incrementCategoryFailure(String stage, String category);

    void incrementHoldExclusion(String category);

    void incrementRunAborted(String reason);
}
