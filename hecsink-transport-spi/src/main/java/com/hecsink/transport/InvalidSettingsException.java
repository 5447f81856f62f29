package com.hecsink.transport;

/** Required settings are missing or out of range. */
public class InvalidSettingsException extends HecConfigurationException {

    public InvalidSettingsException(String message) {
        super(message);
    }

    public InvalidSettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
