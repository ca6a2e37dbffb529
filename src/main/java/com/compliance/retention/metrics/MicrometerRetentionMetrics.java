package com.compliance.retention.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link RetentionMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code retention.run.duration}: Timer (tag: status)</li>
 *   <li>{@code retention.records.deleted}: Counter (tag: category)</li>
 *   <li>{@code retention.records.anonymized}: Counter (tag: category)</li>
 *   <li>{@code retention.category.failures}: Counter (tags: stage, category)</li>
 *   <li>{@code retention.hold.exclusions}: Counter (tag: category)</li>
 *   <li>{@code retention.run.aborted}: Counter (tag: reason)</li>
 * </ul>
 */
public class MicrometerRetentionMetrics implements RetentionMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerRetentionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRunDuration(String status, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(status, k ->
                Timer.builder("retention.run.duration")
                        .description("Duration of retention cycles")
                        .tag("status", status)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRecordsDeleted(String category, long count) {
        counter("deleted:" + category, "retention.records.deleted",
                "Records deleted by retention", "category", category).increment(count);
    }

    @Override
    public void recordRecordsAnonymized(String category, long count) {
        counter("anonymized:" + category, "retention.records.anonymized",
                "Records anonymized before deletion", "category", category).increment(count);
    }

    @Override
    public void incrementCategoryFailure(String stage, String category) {
        String key = "failure:" + stage + ":" + category;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("retention.category.failures")
                        .description("Per-category stage failures")
                        .tag("stage", stage)
                        .tag("category", category)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementHoldExclusion(String category) {
        counter("hold:" + category, "retention.hold.exclusions",
                "Categories excluded by an active legal hold", "category", category).increment();
    }

    @Override
    public void incrementRunAborted(String reason) {
        counter("aborted:" + reason, "retention.run.aborted",
                "Retention cycles aborted before deletion", "reason", reason).increment();
    }

    private Counter counter(String key, String name, String description, String tag, String value) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }
}
