package com.hecsink.transport;

/**
 * Fully read collector response. The underlying connection has already been released.
 */
public record HecResponse(int statusCode, String message, String body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
