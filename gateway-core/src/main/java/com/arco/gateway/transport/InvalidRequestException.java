package com.arco.gateway.transport;

import com.arco.gateway.config.ConfigurationException;

/**
 * The request cannot be sent as given: malformed URL or parameters that do not serialize.
 * Retrying cannot help, so callers report it as a configuration error.
 */
public class InvalidRequestException extends ConfigurationException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
