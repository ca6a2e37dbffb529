package com.compliance.retention;

/**
 * Raised when a retention cycle is aborted before any deletion took place.
 *
 * <p>An aborted cycle produces neither a finalised manifest nor a compliance report.
 * Callers must treat it differently from a report whose status is
 * {@code NEEDS_ATTENTION}, which carries partial results and a manifest.</p>
 */
public abstract class RetentionAbortedException extends RetentionException {

    protected RetentionAbortedException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable reason, used as a metric tag and in the audit trail.
     */
    public abstract String reason();
}
