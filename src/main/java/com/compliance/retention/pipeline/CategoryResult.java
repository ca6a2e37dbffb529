package com.compliance.retention.pipeline;

import java.util.Objects;

/**
 * Result of one category task: a value, or the failure that ended the task.
 *
 * @param category the category the task ran for
 * @param value    the task's value; null on failure
 * @param error    the failure; null on success
 */
public record CategoryResult<T>(String category, T value, Throwable error) {

    public CategoryResult {
        Objects.requireNonNull(category, "category is required");
    }

    public static <T> CategoryResult<T> success(String category, T value) {
        return new CategoryResult<>(category, value, null);
    }

    public static <T> CategoryResult<T> failure(String category, Throwable error) {
        Objects.requireNonNull(error, "error is required");
        return new CategoryResult<>(category, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Failure message suitable for outcomes and audit details.
     */
    public String errorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
