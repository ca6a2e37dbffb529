package com.compliance.retention;

/**
 * Base runtime exception for the retention library.
 */
public class RetentionException extends RuntimeException {

    public RetentionException(String message) {
        super(message);
    }

    public RetentionException(String message, Throwable cause) {
        super(message, cause);
    }
}
