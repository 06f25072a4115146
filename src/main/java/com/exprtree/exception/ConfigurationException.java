package com.exprtree.exception;

/**
 * Exception thrown when driver configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends ExprTreeException {

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
