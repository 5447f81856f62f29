package com.hecsink.transport;

import java.io.IOException;

/** A send was abandoned because its {@link DeliveryContext} was cancelled or ran past its deadline. */
public class DeliveryCancelledException extends IOException {
    private final DeliveryContext.Cause reason;

    public DeliveryCancelledException(DeliveryContext.Cause reason) {
        this(reason, null);
    }

    public DeliveryCancelledException(DeliveryContext.Cause reason, Throwable cause) {
        super(reason == DeliveryContext.Cause.DEADLINE_EXCEEDED ? "deadline exceeded" : "delivery cancelled", cause);
        this.reason = reason;
    }

    public DeliveryContext.Cause reason() {
        return reason;
    }

    public boolean isDeadlineExceeded() {
        return reason == DeliveryContext.Cause.DEADLINE_EXCEEDED;
    }
}
