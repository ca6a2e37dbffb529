package com.compliance.retention.pipeline;

import java.time.Duration;

/**
 * Execution settings of a {@link RetentionPipeline}.
 *
 * @param maxConcurrency  worker threads shared by the per-category stages
 * @param categoryTimeout how long one category task may run before it counts as failed
 * @param deleteBatchSize batch size for graph-store writes
 */
public record PipelineOptions(int maxConcurrency, Duration categoryTimeout, int deleteBatchSize) {

    public PipelineOptions {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
        if (categoryTimeout == null || categoryTimeout.isNegative() || categoryTimeout.isZero()) {
            throw new IllegalArgumentException("categoryTimeout must be positive");
        }
        if (deleteBatchSize <= 0) {
            throw new IllegalArgumentException("deleteBatchSize must be positive");
        }
    }

    public static PipelineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxConcurrency = 4;
        private Duration categoryTimeout = Duration.ofMinutes(5);
        private int deleteBatchSize = 1000;

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder categoryTimeout(Duration categoryTimeout) {
            this.categoryTimeout = categoryTimeout;
            return this;
        }

        public Builder deleteBatchSize(int deleteBatchSize) {
            this.deleteBatchSize = deleteBatchSize;
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(maxConcurrency, categoryTimeout, deleteBatchSize);
        }
    }
}
