package com.hecsink.transport;

/** The collector URL is not a parseable http(s) URL. */
public class InvalidUrlException extends HecConfigurationException {
    private final String url;

    public InvalidUrlException(String url) {
        super("Invalid collector URL: " + url);
        this.url = url;
    }

    public String url() {
        return url;
    }
}
