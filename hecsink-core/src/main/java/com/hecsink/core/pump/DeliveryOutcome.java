package com.hecsink.core.pump;

import com.hecsink.transport.HecResponse;

/**
 * Result of delivering one record of a batch.
 *
 * @param index position of the record in the batch
 * @param response collector answer, {@code null} when the request never completed
 * @param failure why the record counts as undelivered, {@code null} on success
 */
public record DeliveryOutcome(int index, HecResponse response, Exception failure) {

    public static DeliveryOutcome delivered(int index, HecResponse response) {
        return new DeliveryOutcome(index, response, null);
    }

    public static DeliveryOutcome failed(int index, Exception failure) {
        return new DeliveryOutcome(index, null, failure);
    }

    public static DeliveryOutcome failed(int index, HecResponse response, Exception failure) {
        return new DeliveryOutcome(index, response, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
