package com.hecsink.core.pump;

/** What {@link SplunkPump#writeData} does when some events of a batch could not be delivered. */
public enum DeliveryPolicy {
    /** Log and report failures in the returned {@link DeliveryReport}; never throw. */
    FIRE_AND_FORGET,
    /** Throw a {@link BatchDeliveryException} carrying the report when any event failed. */
    AGGREGATE
}
