package com.hecsink.core.pump;

import java.util.List;

/** Per-record outcomes of one batch, in input order. */
public record DeliveryReport(List<DeliveryOutcome> outcomes) {

    public DeliveryReport {
        outcomes = List.copyOf(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public long delivered() {
        return outcomes.stream().filter(DeliveryOutcome::succeeded).count();
    }

    public List<DeliveryOutcome> failures() {
        return outcomes.stream().filter(o -> !o.succeeded()).toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(o -> !o.succeeded());
    }
}
