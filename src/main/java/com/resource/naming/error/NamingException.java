package com.resource.naming.error;

/**
 * Base runtime exception for the naming engine.
 * Messages are caller-safe: they never carry storage error detail.
 */
public abstract class NamingException extends RuntimeException {

    protected NamingException(String message) {
        super(message);
    }

    protected NamingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
