package io.fullerstack.switchboard.config;

/**
 * Thrown when a required configuration key is missing or holds a value of the wrong shape.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
