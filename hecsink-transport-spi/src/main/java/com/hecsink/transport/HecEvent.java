package com.hecsink.transport;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * HEC wire envelope: {@code {"time": <unix seconds>, "event": {...}}}.
 */
@JsonPropertyOrder({"time", "event"})
public record HecEvent(long time, Map<String, Object> event) {

    public HecEvent {
        Objects.requireNonNull(event, "event");
    }

    /** Sub-second precision is dropped; instants before the epoch round down. */
    public static HecEvent of(Map<String, Object> event, Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp");
        return new HecEvent(timestamp.getEpochSecond(), event);
    }
}
