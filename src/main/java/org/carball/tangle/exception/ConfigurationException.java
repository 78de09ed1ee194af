package org.carball.tangle.exception;

/**
 * Invalid configuration detected before any scoring begins.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
