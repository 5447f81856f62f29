package com.hecsink.core.pump;

/**
 * Raised under {@link DeliveryPolicy#AGGREGATE} when at least one record of a batch was not
 * delivered. Each item failure is attached as a suppressed exception.
 */
public class BatchDeliveryException extends Exception {
    private final transient DeliveryReport report;

    public BatchDeliveryException(DeliveryReport report) {
        super(report.failures().size() + " of " + report.size() + " events were not delivered");
        this.report = report;
        report.failures().forEach(o -> addSuppressed(o.failure()));
    }

    public DeliveryReport report() {
        return report;
    }
}
