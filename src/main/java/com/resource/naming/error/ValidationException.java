package com.resource.naming.error;

/**
 * Thrown for malformed input or a rule violation.
 */
public class ValidationException extends NamingException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
