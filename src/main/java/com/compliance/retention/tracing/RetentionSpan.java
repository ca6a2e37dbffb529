package com.compliance.retention.tracing;

/**
 * Span of a retention run, one of its stages, or one category within a stage.
 * Ended on {@link #close()}; a span closed without an outcome carries no status.
 *
 * <pre>
 * try (RetentionSpan span = tracing.startStage(runId, "delete")) {
 *     deleteAll();
 *     span.succeeded();
 * }
 * </pre>
 */
public interface RetentionSpan extends AutoCloseable {

    void succeeded();

    void failed(Throwable error);

    /**
     * Records the verdict and the verified deletion total of a finished run.
     */
    void runFinished(String complianceStatus, long recordsDeleted);

    @Override
    void close();
}
