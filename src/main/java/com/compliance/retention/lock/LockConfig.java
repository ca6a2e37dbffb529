package com.compliance.retention.lock;

/**
 * Configuration for {@link RetentionLock} implementations.
 *
 * @param timeoutMs      maximum time to wait for acquisition
 * @param maxRetries     retry attempts for the graph lock
 * @param retryDelayMs   delay between graph lock attempts
 * @param lockTtlSeconds lifetime of a graph lock node; must outlast a full retention cycle
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs, int lockTtlSeconds) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
        if (lockTtlSeconds <= 0) {
            throw new IllegalArgumentException("lockTtlSeconds must be > 0");
        }
    }

    /**
     * 5s timeout, 3 retries, 100ms delay, 6h TTL.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, 3, 100, 6 * 3600);
    }
}
