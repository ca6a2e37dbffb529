package com.compliance.retention.tracing;

/**
 * Used when no tracer is configured.
 */
public class NoOpTracingService implements TracingService {

    private static final RetentionSpan NO_OP_SPAN = new NoOpSpan();

    @Override
    public RetentionSpan startRun(String runId) {
        return NO_OP_SPAN;
    }

    @Override
    public RetentionSpan startStage(String runId, String stage) {
        return NO_OP_SPAN;
    }

    @Override
    public RetentionSpan startCategory(String runId, String stage, String category) {
        return NO_OP_SPAN;
    }

    private static class NoOpSpan implements RetentionSpan {
        @Override
        public void succeeded() {
        }

        @Override
        public void failed(Throwable error) {
        }

        @Override
        public void runFinished(String complianceStatus, long recordsDeleted) {
        }

        @Override
        public void close() {
        }
    }
}
