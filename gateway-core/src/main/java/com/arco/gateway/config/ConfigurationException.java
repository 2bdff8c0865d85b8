package com.arco.gateway.config;

/**
 * Raised for invalid gateway configuration: unknown API names, invalid registration
 * parameters or property values that fail validation. Never retried.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
