package com.resource.naming.error;

/**
 * Thrown for a malformed rule layer or missing configuration. Fatal at load time.
 */
public class ConfigurationException extends NamingException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFIGURATION;
    }
}
