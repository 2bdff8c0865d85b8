package com.arco.gateway.transport;

/**
 * Status and raw body of a completed call.
 */
public record TransportResponse(int status, String body) {

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public boolean isRateLimited() {
        return status == 429;
    }
}
