package com.compliance.retention.tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 *
 * <p>Every span carries the run id; stage and category spans add the stage and
 * the category. Category spans run on worker threads and are not parented to
 * their stage span.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final AttributeKey<String> RUN_ID = AttributeKey.stringKey("retention.run_id");
    static final AttributeKey<String> STAGE = AttributeKey.stringKey("retention.stage");
    static final AttributeKey<String> CATEGORY = AttributeKey.stringKey("retention.category");
    static final AttributeKey<String> STATUS = AttributeKey.stringKey("retention.compliance_status");
    static final AttributeKey<Long> RECORDS_DELETED = AttributeKey.longKey("retention.records_deleted");

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public RetentionSpan startRun(String runId) {
        return start(tracer.spanBuilder(RUN_SPAN), runId);
    }

    @Override
    public RetentionSpan startStage(String runId, String stage) {
        return start(tracer.spanBuilder(TracingService.stageSpanName(stage))
                .setAttribute(STAGE, stage), runId);
    }

    @Override
    public RetentionSpan startCategory(String runId, String stage, String category) {
        return start(tracer.spanBuilder(TracingService.categorySpanName(stage))
                .setAttribute(STAGE, stage)
                .setAttribute(CATEGORY, category), runId);
    }

    private static RetentionSpan start(SpanBuilder builder, String runId) {
        if (runId != null) {
            builder.setAttribute(RUN_ID, runId);
        }
        return new OTelRetentionSpan(builder.startSpan());
    }

    private static class OTelRetentionSpan implements RetentionSpan {

        private final Span span;

        OTelRetentionSpan(Span span) {
            this.span = span;
        }

        @Override
        public void succeeded() {
            span.setStatus(StatusCode.OK);
        }

        @Override
        public void failed(Throwable error) {
            span.recordException(error);
            span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
        }

        @Override
        public void runFinished(String complianceStatus, long recordsDeleted) {
            span.setAttribute(STATUS, complianceStatus);
            span.setAttribute(RECORDS_DELETED, recordsDeleted);
        }

        @Override
        public void close() {
            span.end();
        }
    }
}
