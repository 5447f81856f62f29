package com.hecsink.transport;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Minimal transport SPI: deliver one event to a Splunk HTTP Event Collector.
 *
 * <p>Implementations are immutable once constructed and may be shared by concurrent
 * {@link #send} calls. Status codes are returned as-is; whether a non-2xx answer is a failure
 * is decided by the caller.
 */
public interface HecSender extends Closeable {
    String COLLECTOR_PATH = "/services/collector/event/1.0";
    String AUTH_HEADER = "authorization";
    String AUTH_SCHEME = "Splunk ";

    /**
     * Posts {@code {"time": <unix seconds of timestamp>, "event": event}} to {@link #endpoint()}.
     *
     * @throws DeliveryCancelledException if {@code ctx} is cancelled or expires before the call completes
     * @throws IOException on serialization or network failure
     */
    HecResponse send(DeliveryContext ctx, Map<String, Object> event, Instant timestamp) throws IOException;

    /** Resolved collector endpoint, always ending in {@link #COLLECTOR_PATH}. */
    String endpoint();

    @Override
    default void close() throws IOException {
        /* no-op */
    }

    static String authorization(String token) {
        return AUTH_SCHEME + token;
    }
}
