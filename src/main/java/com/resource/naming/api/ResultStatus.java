package com.resource.naming.api;

import com.resource.naming.error.ErrorKind;

/**
 * Typed outcome of an external operation.
 */
public enum ResultStatus {
    SUCCESS(200),
    INVALID(400),
    FORBIDDEN(403),
    NOT_FOUND(404),
    CONFLICT(409),
    UPSTREAM_ERROR(502);

    private final int httpStatus;

    ResultStatus(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Status for an expected failure kind. Configuration errors surface as INVALID
     * only when raised per request, e.g. a rule that cannot be applied to the payload.
     */
    public static ResultStatus of(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION, CONFIGURATION -> INVALID;
            case CONFLICT -> CONFLICT;
            case NOT_FOUND -> NOT_FOUND;
            case AUTHORIZATION -> FORBIDDEN;
            case UPSTREAM -> UPSTREAM_ERROR;
        };
    }
}
