package com.compliance.retention.manifest;

import com.compliance.retention.RetentionAbortedException;

/**
 * Raised when a manifest cannot be written before deletion.
 * No category is deleted without a durable manifest, so the run aborts.
 */
public class ManifestPersistException extends RetentionAbortedException {

    public static final String REASON = "manifest-persist";

    public ManifestPersistException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return REASON;
    }
}
