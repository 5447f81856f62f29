package com.hecsink.transport;

/**
 * Raised while building a sender or pump. A component whose construction failed must not be used.
 */
public class HecConfigurationException extends RuntimeException {

    public HecConfigurationException(String message) {
        super(message);
    }

    public HecConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
