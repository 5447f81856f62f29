package com.hecsink.transport;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancellation and deadline signal handed to every delivery call.
 *
 * <p>A context is cancelled at most once, either explicitly through {@link #cancel()} or when
 * its deadline passes. Listeners registered with {@link #onCancel(Runnable)} run exactly once on
 * the cancelling thread; senders use them to abort in-flight requests. Children derived with
 * {@link #childWithTimeout(Duration)} are cancelled together with their parent.
 *
 * <p>Closing a context cancels it, which also releases its deadline timer and its registration
 * with the parent.
 */
public final class DeliveryContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeliveryContext.class);

    private static final ScheduledThreadPoolExecutor TIMER = newTimer();

    public enum Cause {
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    /** Handle returned by {@link #onCancel(Runnable)}; closing it drops the listener. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final Instant deadline;
    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();

    private volatile Cause cause;
    private ScheduledFuture<?> timer;
    private Registration parentRegistration;

    private DeliveryContext(Instant deadline) {
        this.deadline = deadline;
    }

    /** A context that is never cancelled unless {@link #cancel()} is called. */
    public static DeliveryContext background() {
        return new DeliveryContext(null);
    }

    public static DeliveryContext withDeadline(Instant deadline) {
        DeliveryContext ctx = new DeliveryContext(Objects.requireNonNull(deadline, "deadline"));
        ctx.armTimer();
        return ctx;
    }

    public static DeliveryContext withTimeout(Duration timeout) {
        return withDeadline(Instant.now().plus(Objects.requireNonNull(timeout, "timeout")));
    }

    /**
     * Derives a child that expires after {@code timeout} or at this context's deadline,
     * whichever comes first, and is cancelled whenever this context is.
     */
    public DeliveryContext childWithTimeout(Duration timeout) {
        Instant childDeadline = Instant.now().plus(Objects.requireNonNull(timeout, "timeout"));
        if (deadline != null && deadline.isBefore(childDeadline)) {
            childDeadline = deadline;
        }
        DeliveryContext child = new DeliveryContext(childDeadline);
        Registration registration = onCancel(() -> child.cancel(cause == null ? Cause.CANCELLED : cause));
        synchronized (child.lock) {
            child.parentRegistration = registration;
        }
        child.armTimer();
        return child;
    }

    public void cancel() {
        cancel(Cause.CANCELLED);
    }

    public boolean isCancelled() {
        return cause != null;
    }

    public Optional<Cause> cause() {
        return Optional.ofNullable(cause);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /** Time left until the deadline, never negative; empty when there is no deadline. */
    public Optional<Duration> remaining() {
        if (deadline == null) return Optional.empty();
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public void throwIfCancelled() throws DeliveryCancelledException {
        Cause c = cause;
        if (c != null) throw new DeliveryCancelledException(c);
    }

    /**
     * Registers {@code listener} to run on cancellation. Runs it immediately when the context is
     * already cancelled.
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (lock) {
            if (cause == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        runQuietly(listener);
        return () -> {};
    }

    @Override
    public void close() {
        cancel();
    }

    private void cancel(Cause reason) {
        List<Runnable> toRun;
        Registration fromParent;
        synchronized (lock) {
            if (cause != null) return;
            cause = reason;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
            fromParent = parentRegistration;
            parentRegistration = null;
        }
        if (fromParent != null) fromParent.close();
        toRun.forEach(DeliveryContext::runQuietly);
    }

    private void armTimer() {
        long delayNanos = Duration.between(Instant.now(), deadline).toNanos();
        if (delayNanos <= 0) {
            cancel(Cause.DEADLINE_EXCEEDED);
            return;
        }
        ScheduledFuture<?> scheduled =
                TIMER.schedule(() -> cancel(Cause.DEADLINE_EXCEEDED), delayNanos, TimeUnit.NANOSECONDS);
        synchronized (lock) {
            if (cause == null) {
                timer = scheduled;
                return;
            }
        }
        scheduled.cancel(false);
    }

    private static void runQuietly(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener {} failed: {}", listener, e.getMessage(), e);
        }
    }

    private static ScheduledThreadPoolExecutor newTimer() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "hecsink-deadline-timer");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Override
    public String toString() {
        return "DeliveryContext[deadline=" + deadline + ", cause=" + cause + "]";
    }
}
