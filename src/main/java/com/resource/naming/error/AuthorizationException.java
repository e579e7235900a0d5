package com.resource.naming.error;

/**
 * Thrown for an insufficient role or missing ownership.
 */
public class AuthorizationException extends NamingException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTHORIZATION;
    }
}
