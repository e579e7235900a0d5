package com.resource.naming.error;

/**
 * Thrown for a concurrent claim or a stale release. Callers should re-read and retry.
 */
public class ConflictException extends NamingException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }
}
