package com.resource.naming.error;

/**
 * Thrown for a slug feed that could not be parsed.
 */
public class UpstreamException extends NamingException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UPSTREAM;
    }
}
