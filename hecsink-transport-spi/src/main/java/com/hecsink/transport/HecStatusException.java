package com.hecsink.transport;

import java.io.IOException;

/**
 * Non-2xx collector answer, raised only by callers that opt into strict status handling.
 */
public class HecStatusException extends IOException {
    private final transient HecResponse response;

    public HecStatusException(HecResponse response) {
        super("HTTP " + response.statusCode() + " - " + response.body());
        this.response = response;
    }

    public HecResponse response() {
        return response;
    }

    public int statusCode() {
        return response.statusCode();
    }
}
