package com.hecsink.testkit;

import com.hecsink.transport.DeliveryContext;
import com.hecsink.transport.HecEvent;
import com.hecsink.transport.HecResponse;
import com.hecsink.transport.HecSender;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/** Test double that records envelopes in memory instead of posting them. */
public class InMemoryHecSender implements HecSender {
    private final List<HecEvent> sent = Collections.synchronizedList(new ArrayList<>());
    private volatile Predicate<Map<String, Object>> failWhen = event -> false;
    private volatile int statusCode = 200;
    private volatile boolean closed;

    @Override
    public HecResponse send(DeliveryContext ctx, Map<String, Object> event, Instant timestamp) throws IOException {
        ctx.throwIfCancelled();
        if (failWhen.test(event)) {
            throw new IOException("simulated transport failure");
        }
        sent.add(HecEvent.of(event, timestamp));
        return new HecResponse(statusCode, statusCode < 300 ? "OK" : "Error", "");
    }

    @Override
    public String endpoint() {
        return "memory://" + COLLECTOR_PATH;
    }

    @Override
    public void close() {
        closed = true;
    }

    /** Events matching {@code predicate} fail with an {@link IOException} and are not recorded. */
    public InMemoryHecSender failWhen(Predicate<Map<String, Object>> predicate) {
        this.failWhen = predicate;
        return this;
    }

    /** Status code reported for every recorded event. */
    public InMemoryHecSender respondWith(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public List<HecEvent> sent() {
        synchronized (sent) {
            return List.copyOf(sent);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public void clear() {
        sent.clear();
    }
}
