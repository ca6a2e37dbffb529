package com.compliance.retention.lock;

import com.compliance.retention.RetentionException;

/**
 * Thrown when a retention lock cannot be acquired within the configured timeout.
 * For the run lock this means another cycle is active; nothing has been touched.
 */
public class LockAcquisitionException extends RetentionException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
