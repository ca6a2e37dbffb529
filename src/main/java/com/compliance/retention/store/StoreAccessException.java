package com.compliance.retention.store;

import com.compliance.retention.RetentionException;

/**
 * Runtime exception thrown when a record, hold, manifest or report store
 * cannot complete an operation.
 */
public class StoreAccessException extends RetentionException {

    public StoreAccessException(String message) {
        super(message);
    }

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
