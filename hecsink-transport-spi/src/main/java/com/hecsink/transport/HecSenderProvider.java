package com.hecsink.transport;

/**
 * Factory looked up through {@link java.util.ServiceLoader} so callers that only see the SPI
 * can still build a concrete sender.
 */
public interface HecSenderProvider {

    /** Short identifier, e.g. {@code okhttp}. */
    String name();

    /**
     * @throws HecConfigurationException if the settings cannot produce a working sender
     */
    HecSender create(HecTransportSettings settings);
}
