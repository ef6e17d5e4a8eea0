package io.github.wcarmon.ttlcache;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically removes expired entries from an {@link EntryStore}.
 * <p>
 * Started once, stopped at most once.
 * Runs are spaced by a fixed delay (measured from the end of one run to the start of the next),
 * so a slow sweep never queues up back-to-back runs.
 * When no executor is supplied, a single daemon thread is created and shut down on stop.
 * A supplied executor is left running; only this sweeper's task is cancelled.
 */
final class ExpirationSweeper {

    static final String THREAD_NAME = "ttl-cache-sweeper";

    private static final Logger log = LoggerFactory.getLogger(ExpirationSweeper.class);

    private static final Duration MAX_INTERVAL = Duration.ofNanos(Long.MAX_VALUE);

    /** Executes the periodic sweep */
    private final ScheduledExecutorService executorService;

    private final Duration interval;

    /** true when executorService was created here and must be shut down on stop */
    private final boolean ownsExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final EntryStore<?, ?> store;

    @Nullable
    private volatile ScheduledFuture<?> task;

    ExpirationSweeper(
            EntryStore<?, ?> store,
            Duration interval,
            @Nullable ScheduledExecutorService executorService) {

        requireNonNull(store, "store is required and null.");
        requireNonNull(interval, "interval is required and null.");

        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }

        this.store = store;
        this.interval = interval;
        this.ownsExecutor = executorService == null;
        this.executorService = executorService == null
                ? newDaemonExecutor()
                : executorService;
    }

    private static ScheduledExecutorService newDaemonExecutor() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
    }

    boolean isRunning() {
        return running.get();
    }

    /**
     * Schedules the sweep with a fixed delay of interval between runs.
     *
     * @throws IllegalStateException when already started
     */
    void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("sweeper already started");
        }

        final long nanos = interval.compareTo(MAX_INTERVAL) >= 0
                ? Long.MAX_VALUE
                : interval.toNanos();

        task = executorService.scheduleWithFixedDelay(
                this::sweep,
                nanos,
                nanos,
                TimeUnit.NANOSECONDS);

        log.debug("Expiration sweep started: interval={}", interval);
    }

    /**
     * Stops the sweep when running.
     *
     * @return true when this call stopped it, false when it was not running
     */
    boolean stop() {
        if (!running.compareAndSet(true, false)) {
            return false;
        }

        final ScheduledFuture<?> current = task;
        if (current != null) {
            current.cancel(false);
        }

        if (ownsExecutor) {
            executorService.shutdown();
        }

        log.debug("Expiration sweep stopped");
        return true;
    }

    /**
     * One sweep pass.
     * Failures are logged, the next run still happens.
     */
    void sweep() {
        try {
            final int removed = store.cleanExpired();
            if (removed > 0) {
                log.debug("Swept {} expired entries", removed);
            }

        } catch (RuntimeException ex) {
            log.error("Expiration sweep failed", ex);
        }
    }
}
