package com.seriesguard.engine;

/**
 * Thrown when the engine configuration cannot be read or describes an unusable engine.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
