package com.resource.naming.api;

/**
 * Degraded conditions attached to an otherwise successful result.
 */
public enum ResultWarning {
    /**
     * The claim or release was committed but its audit entry could not be written.
     */
    AUDIT_WRITE_FAILED
}
