package com.arco.gateway.transport;

import java.io.Closeable;
import java.io.IOException;

/**
 * One network round trip. Non-2xx statuses are returned, not thrown; only
 * connection-level failures and timeouts raise {@link IOException}. A request that
 * cannot be sent at all raises {@link InvalidRequestException}.
 */
public interface HttpTransport extends Closeable {

    TransportResponse execute(TransportRequest request) throws IOException;

    /**
     * Reject a request that could never be sent, before any permit is taken for it.
     *
     * @throws InvalidRequestException if the request is malformed
     */
    default void checkRequest(TransportRequest request) {
    }
}
