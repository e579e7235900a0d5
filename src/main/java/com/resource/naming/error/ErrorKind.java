package com.resource.naming.error;

/**
 * Coarse classification of naming failures, used to map exceptions onto typed results.
 */
public enum ErrorKind {
    VALIDATION,
    CONFLICT,
    NOT_FOUND,
    AUTHORIZATION,
    CONFIGURATION,
    UPSTREAM
}
