package com.compliance.retention.report;

import com.compliance.retention.RetentionException;

/**
 * Thrown by report storage. The reporter logs it and returns the unsaved report.
 */
public class ReportPersistException extends RetentionException {

    public ReportPersistException(String message) {
        super(message);
    }

    public ReportPersistException(String message, Throwable cause) {
        super(message, cause);
    }
}
