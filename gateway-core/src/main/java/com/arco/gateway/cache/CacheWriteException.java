package com.arco.gateway.cache;

import java.io.IOException;

/**
 * A cache store could not persist an entry. Always absorbed by {@link PersistentResponseCache}.
 */
public class CacheWriteException extends IOException {

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
