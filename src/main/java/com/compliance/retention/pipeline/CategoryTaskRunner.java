package com.compliance.retention.pipeline;

import com.compliance.retention.logging.LogContext;
import com.compliance.retention.tracing.NoOpTracingService;
import com.compliance.retention.tracing.RetentionSpan;
import com.compliance.retention.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one task per category on a bounded worker pool and waits for all of them.
 *
 * <p>Each task is isolated: an exception or a timeout becomes a failed
 * {@link CategoryResult} for that category only. Results come back keyed by
 * category in submission order.</p>
 *
 * <p>The timeout of a task starts when a worker picks it up, so time spent
 * queued behind other categories does not count. A task that exceeds it is
 * interrupted and reported as timed out; a store call that ignores the
 * interrupt keeps its worker until it returns, and its late result is discarded.</p>
 *
 * <p>Each task runs inside a category span of the configured {@link TracingService}.</p>
 */
public class CategoryTaskRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CategoryTaskRunner.class);

    private final ExecutorService executor;
    private final ScheduledExecutorService deadlines;
    private final Duration categoryTimeout;
    private final TracingService tracingService;

    public CategoryTaskRunner(int maxConcurrency, Duration categoryTimeout) {
        this(maxConcurrency, categoryTimeout, new NoOpTracingService());
    }

    public CategoryTaskRunner(int maxConcurrency, Duration categoryTimeout, TracingService tracingService) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be positive");
        }
        if (categoryTimeout == null || categoryTimeout.isNegative() || categoryTimeout.isZero()) {
            throw new IllegalArgumentException("categoryTimeout must be positive");
        }
        this.executor = Executors.newFixedThreadPool(maxConcurrency, new WorkerThreadFactory("retention-worker-"));
        this.deadlines = Executors.newSingleThreadScheduledExecutor(new WorkerThreadFactory("retention-deadline-"));
        this.categoryTimeout = categoryTimeout;
        this.tracingService = tracingService;
    }

    public CategoryTaskRunner(PipelineOptions options, TracingService tracingService) {
        this(options.maxConcurrency(), options.categoryTimeout(), tracingService);
    }

    /**
     * Runs {@code task} for every category and returns once each has succeeded,
     * failed or timed out.
     *
     * @param stage      stage name, put in the log context of each task
     * @param runId      run id, put in the log context of each task; may be null
     * @param categories categories to process, in result order
     * @param task       work for one category
     */
    public <T> Map<String, CategoryResult<T>> runAll(String stage, String runId,
                                                    Collection<String> categories,
                                                    Function<String, T> task) {
        Map<String, CompletableFuture<T>> futures = new LinkedHashMap<>();
        for (String category : categories) {
            CompletableFuture<T> result = new CompletableFuture<>();
            executor.execute(() -> runTask(stage, runId, category, task, result));
            futures.put(category, result);
        }

        Map<String, CategoryResult<T>> results = new LinkedHashMap<>();
        futures.forEach((category, future) -> results.put(category, await(category, future)));
        return results;
    }

    private <T> void runTask(String stage, String runId, String category,
                             Function<String, T> task, CompletableFuture<T> result) {
        WorkerGuard guard = new WorkerGuard(Thread.currentThread());
        ScheduledFuture<?> deadline = deadlines.schedule(() -> {
            TimeoutException timeout = new TimeoutException("Category " + category + " exceeded "
                    + categoryTimeout + " in stage " + stage);
            if (result.completeExceptionally(timeout)) {
                log.warn("retention.task.timeout stage={} category={} timeout={}", stage, category, categoryTimeout);
                guard.interrupt();
            }
        }, categoryTimeout.toMillis(), TimeUnit.MILLISECONDS);

        RetentionSpan span = tracingService.startCategory(runId, stage, category);
        try (LogContext ctx = LogContext.forCategory(runId, stage, category)) {
            if (result.complete(task.apply(category))) {
                span.succeeded();
            } else {
                span.failed(result.handle((value, error) -> error).join());
            }
        } catch (Throwable t) {
            result.completeExceptionally(t);
            span.failed(t);
        } finally {
            deadline.cancel(false);
            guard.release();
            span.close();
        }
    }

    private <T> CategoryResult<T> await(String category, CompletableFuture<T> future) {
        try {
            return CategoryResult.success(category, future.join());
        } catch (CompletionException e) {
            return CategoryResult.failure(category, e.getCause() != null ? e.getCause() : e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(categoryTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            deadlines.shutdownNow();
        }
    }

    /**
     * Interrupts a timed-out task only while it still owns its worker thread.
     */
    private static final class WorkerGuard {
        private final Thread worker;
        private boolean released;

        private WorkerGuard(Thread worker) {
            this.worker = worker;
        }

        synchronized void interrupt() {
            if (!released) {
                worker.interrupt();
            }
        }

        synchronized void release() {
            released = true;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();
        private final String prefix;

        private WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
