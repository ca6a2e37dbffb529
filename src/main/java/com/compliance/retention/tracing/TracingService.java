package com.compliance.retention.tracing;

/**
 * Tracing for retention cycles: a span per run, one per stage beneath it,
 * and one per category task. Span names are {@code retention.run},
 * {@code retention.<stage>} and {@code retention.<stage>.category}.
 */
public interface TracingService {

    String RUN_SPAN = "retention.run";

    RetentionSpan startRun(String runId);

    RetentionSpan startStage(String runId, String stage);

    RetentionSpan startCategory(String runId, String stage, String category);

    static String stageSpanName(String stage) {
        return "retention." + stage;
    }

    static String categorySpanName(String stage) {
        return stageSpanName(stage) + ".category";
    }
}
