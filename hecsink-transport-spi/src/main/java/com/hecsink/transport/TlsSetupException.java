package com.hecsink.transport;

/** Client certificate, key or trust material could not be loaded. */
public class TlsSetupException extends HecConfigurationException {

    public TlsSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
