package com.compliance.retention.hold;

import com.compliance.retention.RetentionAbortedException;

/**
 * Raised when active legal holds cannot be determined.
 * Proceeding without hold information could delete held data, so the run aborts.
 */
public class HoldLookupException extends RetentionAbortedException {

    public static final String REASON = "hold-lookup";

    public HoldLookupException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return REASON;
    }
}
