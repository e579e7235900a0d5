package com.resource.naming.error;

/**
 * Thrown for an unknown resource type, slug or name.
 */
public class NotFoundException extends NamingException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
