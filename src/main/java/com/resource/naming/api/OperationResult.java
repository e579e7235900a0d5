package com.resource.naming.api;

import java.util.Objects;

/**
 * Typed result of a read or maintenance operation.
 *
 * @param status  outcome
 * @param message caller-facing message on failure, null on success
 * @param value   payload on success, null on failure
 */
public record OperationResult<T>(ResultStatus status, String message, T value) {

    public OperationResult {
        Objects.requireNonNull(status, "status is required");
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(ResultStatus.SUCCESS, null, value);
    }

    public static <T> OperationResult<T> failure(ResultStatus status, String message) {
        if (status == ResultStatus.SUCCESS) {
            throw new IllegalArgumentException("failure status must not be SUCCESS");
        }
        return new OperationResult<>(status, message, null);
    }

    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }
}
