package com.compliance.retention.pipeline;

import com.compliance.retention.logging.LogContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CategoryTaskRunner Tests")
class CategoryTaskRunnerTest {

    private CategoryTaskRunner runner;

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.close();
        }
    }

    @Test
    @DisplayName("Results are keyed by category in submission order")
    void resultsKeepOrder() {
        runner = new CategoryTaskRunner(4, Duration.ofSeconds(5));

        Map<String, CategoryResult<Integer>> results = runner.runAll("scan", "run-1",
                List.of("gamma", "alpha", "beta"), String::length);

        assertEquals(List.of("gamma", "alpha", "beta"), List.copyOf(results.keySet()));
        assertEquals(5, results.get("gamma").value());
        assertTrue(results.values().stream().allMatch(CategoryResult::isSuccess));
    }

    @Test
    @DisplayName("A failing category does not affect its siblings")
    void failureIsIsolated() {
        runner = new CategoryTaskRunner(2, Duration.ofSeconds(5));

        Map<String, CategoryResult<String>> results = runner.runAll("delete", "run-1",
                List.of("ok_one", "broken", "ok_two"), category -> {
                    if (category.equals("broken")) {
                        throw new IllegalStateException("constraint violated");
                    }
                    return category.toUpperCase();
                });

        assertTrue(results.get("ok_one").isSuccess());
        assertTrue(results.get("ok_two").isSuccess());
        assertFalse(results.get("broken").isSuccess());
        assertEquals("constraint violated", results.get("broken").errorMessage());
        assertInstanceOf(IllegalStateException.class, results.get("broken").error());
    }

    @Test
    @DisplayName("A task exceeding the timeout fails with a timeout error")
    void timeoutFailsCategory() {
        runner = new CategoryTaskRunner(2, Duration.ofMillis(100));
        CountDownLatch release = new CountDownLatch(1);

        Map<String, CategoryResult<String>> results = runner.runAll("anonymize", "run-1",
                List.of("slow", "fast"), category -> {
                    if (category.equals("slow")) {
                        try {
                            release.await(2, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return category;
                });
        release.countDown();

        assertTrue(results.get("fast").isSuccess());
        assertFalse(results.get("slow").isSuccess());
        assertInstanceOf(TimeoutException.class, results.get("slow").error());
        assertTrue(results.get("slow").errorMessage().contains("slow"));
    }

    @Test
    @DisplayName("Time spent queued behind other categories does not count against the timeout")
    void queuedTimeIsNotCharged() {
        runner = new CategoryTaskRunner(1, Duration.ofMillis(400));

        Map<String, CategoryResult<String>> results = runner.runAll("delete", "run-1",
                List.of("a_cat", "b_cat", "c_cat"), category -> {
                    try {
                        Thread.sleep(150);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException("interrupted", e);
                    }
                    return category;
                });

        assertTrue(results.values().stream().allMatch(CategoryResult::isSuccess), results.toString());
        assertEquals("c_cat", results.get("c_cat").value());
    }

    @Test
    @DisplayName("A timed-out task is interrupted and frees its worker for the next category")
    void timedOutTaskIsInterrupted() {
        runner = new CategoryTaskRunner(1, Duration.ofMillis(200));
        AtomicInteger interrupted = new AtomicInteger();

        Map<String, CategoryResult<String>> results = runner.runAll("scan", "run-1",
                List.of("stuck", "next"), category -> {
                    if (category.equals("stuck")) {
                        try {
                            Thread.sleep(5000);
                        } catch (InterruptedException e) {
                            interrupted.incrementAndGet();
                            Thread.currentThread().interrupt();
                        }
                    }
                    return category;
                });

        assertInstanceOf(TimeoutException.class, results.get("stuck").error());
        assertTrue(results.get("next").isSuccess());
        assertEquals(1, interrupted.get());
    }

    @Test
    @DisplayName("Concurrency never exceeds the configured maximum")
    void concurrencyIsBounded() {
        runner = new CategoryTaskRunner(2, Duration.ofSeconds(5));
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        runner.runAll("scan", null, List.of("a", "b", "c", "d", "e", "f"), category -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                active.decrementAndGet();
            }
            return category;
        });

        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
    }

    @Test
    @DisplayName("Each task runs with run, stage and category in the MDC")
    void tasksCarryLogContext() {
        runner = new CategoryTaskRunner(2, Duration.ofSeconds(5));
        Map<String, String> seen = new ConcurrentHashMap<>();

        runner.runAll("scan", "run-42", List.of("session_data", "user_profiles"), category -> {
            seen.put(category, MDC.get(LogContext.RUN_ID) + "|" + MDC.get(LogContext.STAGE) + "|"
                    + MDC.get(LogContext.CATEGORY));
            return category;
        });

        assertEquals("run-42|scan|session_data", seen.get("session_data"));
        assertEquals("run-42|scan|user_profiles", seen.get("user_profiles"));
    }

    @Test
    @DisplayName("Rejects invalid settings")
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new CategoryTaskRunner(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new CategoryTaskRunner(1, Duration.ZERO));
    }
}
