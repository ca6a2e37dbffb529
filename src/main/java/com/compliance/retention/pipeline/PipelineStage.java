package com.compliance.retention.pipeline;

/**
 * Stages of a retention cycle, in execution order.
 */
public enum PipelineStage {
    SCAN("scan"),
    HOLD_FILTER("hold-filter"),
    ANONYMIZE("anonymize"),
    MANIFEST("manifest"),
    DELETE("delete"),
    REPORT("report"),
    NOTIFY("notify");

    private final String label;

    PipelineStage(String label) {
        this.label = label;
    }

    /**
     * Name used in logs, metric tags and span names.
     */
    public String label() {
        return label;
    }
}
