package com.compliance.retention.policy;

import com.compliance.retention.RetentionException;

/**
 * Thrown when a retention policy document cannot be read or is invalid.
 */
public class RetentionConfigurationException extends RetentionException {

    public RetentionConfigurationException(String message) {
        super(message);
    }

    public RetentionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
