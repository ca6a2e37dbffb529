package com.compliance.retention.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link RetentionMetrics}.
 */
public class NoOpRetentionMetrics implements RetentionMetrics {

    @Override
    public void recordRunDuration(String status, Duration duration) {
    }

    @Override
    public void recordRecordsDeleted(String category, long count) {
    }

    @Override
    public void recordRecordsAnonymized(String category, long count) {
    }

    @Override
    public void incrementCategoryFailure(String stage, String category) {
    }

    @Override
    public void incrementHoldExclusion(String category) {
    }

    @Override
    public void incrementRunAborted(String reason) {
    }
}
