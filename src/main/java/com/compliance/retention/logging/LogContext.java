package com.compliance.retention.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCategory(runId, "delete", "session_data")) {
 *     log.info("retention.delete.completed deleted={}", deleted);
 * }
 * </pre>
 *
 * <p>MDC is thread-bound, so worker tasks open their own context.</p>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String STAGE = "stage";
    public static final String CATEGORY = "category";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a context for a whole retention cycle.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        return ctx;
    }

    /**
     * Creates a context for one category within a pipeline stage.
     */
    public static LogContext forCategory(String runId, String stage, String category) {
        LogContext ctx = new LogContext();
        if (runId != null) {
            ctx.put(RUN_ID, runId);
        }
        ctx.put(STAGE, stage);
        ctx.put(CATEGORY, category);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds a key-value pair to this context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
