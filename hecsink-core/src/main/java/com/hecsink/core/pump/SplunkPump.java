package com.hecsink.core.pump;

import com.hecsink.core.model.AnalyticsRecord;
import com.hecsink.core.projection.EventTransformer;
import com.hecsink.transport.DeliveryCancelledException;
import com.hecsink.transport.DeliveryContext;
import com.hecsink.transport.HecResponse;
import com.hecsink.transport.HecSender;
import com.hecsink.transport.HecSenders;
import com.hecsink.transport.HecStatusException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers batches of analytics records to a Splunk HTTP Event Collector, one request per record.
 *
 * <p>Delivery is best effort: there is no retry and no buffering. What happens to failed items
 * is governed by {@link DeliveryPolicy}; the per-item outcome is always available in the
 * returned {@link DeliveryReport}.
 */
public class SplunkPump implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SplunkPump.class);

    public static final String NAME = "Splunk Pump";

    private final SplunkPumpConfig config;
    private final HecSender client;
    private final EventTransformer transformer;
    private final DeliveryPolicy deliveryPolicy;
    private final boolean failOnHttpError;
    private final Duration batchTimeout;
    private final ExecutorService workers;

    /**
     * Builds a pump from a snapshot of {@code config}; changing {@code config} afterwards has no
     * effect on the pump.
     */
    public SplunkPump(SplunkPumpConfig config, HecSender client) {
        this.config = Objects.requireNonNull(config, "config").copy().validate();
        this.client = Objects.requireNonNull(client, "client");
        this.transformer = new EventTransformer(this.config.toProjectionConfig());
        this.deliveryPolicy = this.config.getDeliveryPolicy();
        this.failOnHttpError = this.config.isFailOnHttpError();
        this.batchTimeout = this.config.getTimeout() > 0 ? Duration.ofSeconds(this.config.getTimeout()) : null;
        this.workers = this.config.getMaxConcurrency() > 1 ? newWorkerPool(this.config.getMaxConcurrency()) : null;
    }

    /**
     * Decodes {@code rawConfig}, builds the transport found on the class path and returns a
     * ready pump.
     *
     * @throws com.hecsink.transport.HecConfigurationException if the configuration is unusable
     */
    public static SplunkPump init(Map<String, ?> rawConfig) {
        SplunkPumpConfig config = SplunkPumpConfig.fromMap(rawConfig).validate();
        log.info("{} Endpoint: {}", NAME, config.getCollectorUrl());
        HecSender sender = HecSenders.create(config.toTransportSettings());
        SplunkPump pump = new SplunkPump(config, sender);
        log.debug("{} Initialized", NAME);
        return pump;
    }

    public String name() {
        return NAME;
    }

    public String endpoint() {
        return client.endpoint();
    }

    /** A copy of the settings this pump runs with. */
    public SplunkPumpConfig config() {
        return config.copy();
    }

    /**
     * Transforms and sends every record in input order.
     *
     * @return one outcome per record, in input order
     * @throws BatchDeliveryException only under {@link DeliveryPolicy#AGGREGATE}, when any record failed
     */
    public DeliveryReport writeData(DeliveryContext ctx, List<AnalyticsRecord> records) throws BatchDeliveryException {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(records, "records");
        log.info("Writing {} records", records.size());

        DeliveryContext batchCtx = batchTimeout != null ? ctx.childWithTimeout(batchTimeout) : ctx;
        List<DeliveryOutcome> outcomes;
        try {
            outcomes = workers == null ? deliverInOrder(batchCtx, records) : deliverConcurrently(batchCtx, records);
        } finally {
            if (batchCtx != ctx) batchCtx.close();
        }

        DeliveryReport report = new DeliveryReport(outcomes);
        if (report.hasFailures()) {
            log.warn("{}: {} of {} events were not delivered", NAME, report.failures().size(), report.size());
            if (deliveryPolicy == DeliveryPolicy.AGGREGATE) {
                throw new BatchDeliveryException(report);
            }
        }
        return report;
    }

    private List<DeliveryOutcome> deliverInOrder(DeliveryContext ctx, List<AnalyticsRecord> records) {
        List<DeliveryOutcome> outcomes = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            outcomes.add(deliver(ctx, i, records.get(i)));
        }
        return outcomes;
    }

    private List<DeliveryOutcome> deliverConcurrently(DeliveryContext ctx, List<AnalyticsRecord> records) {
        List<Future<DeliveryOutcome>> futures = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            final int index = i;
            final AnalyticsRecord record = records.get(i);
            futures.add(workers.submit(() -> deliver(ctx, index, record)));
        }

        List<DeliveryOutcome> outcomes = new ArrayList<>(records.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                outcomes.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    outcomes.add(DeliveryOutcome.failed(
                            j, new DeliveryCancelledException(DeliveryContext.Cause.CANCELLED, e)));
                }
                break;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                outcomes.add(DeliveryOutcome.failed(i, cause instanceof Exception ex ? ex : e));
            }
        }
        return outcomes;
    }

    private DeliveryOutcome deliver(DeliveryContext ctx, int index, AnalyticsRecord record) {
        HecResponse response = null;
        try {
            Map<String, Object> event = transformer.transform(record);
            Instant timestamp = record.timeStamp() != null ? record.timeStamp() : Instant.now();
            response = client.send(ctx, event, timestamp);
            if (failOnHttpError && !response.isSuccessful()) {
                throw new HecStatusException(response);
            }
            return DeliveryOutcome.delivered(index, response);
        } catch (IOException | RuntimeException e) {
            log.warn("{} could not deliver record #{} {}: {}", NAME, index, record, e.getMessage());
            return DeliveryOutcome.failed(index, response, e);
        }
    }

    @Override
    public void close() throws IOException {
        if (workers != null) workers.shutdownNow();
        client.close();
    }

    private static ExecutorService newWorkerPool(int size) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "hecsink-delivery-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String toString() {
        return "SplunkPump[" + client.endpoint() + ", policy=" + deliveryPolicy + "]";
    }
}
