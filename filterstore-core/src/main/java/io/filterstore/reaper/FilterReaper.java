package io.filterstore.reaper;

import io.filterstore.Filter;
import io.filterstore.spi.MetricsExporter;
import io.filterstore.store.FilterNotFoundException;
import io.filterstore.store.FilterStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that evicts filters whose results have not been taken
 * within a configurable time-to-live.
 *
 * <p>Each cycle asks the store for filters {@linkplain FilterStore#notTakenSince not taken
 * since} {@code now - ttl}, then removes each one from the store, clears its subscriber
 * channel and notifies the {@link FilterEvictionListener}. A filter removed by
 * someone else in the meantime is skipped.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see FilterReaper.Builder
 */
public final class FilterReaper implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(FilterReaper.class.getName());

    private final FilterStore store;
    private final Duration ttl;
    private final Duration interval;
    private final Clock clock;
    private final FilterEvictionListener evictionListener;
    private final MetricsExporter metrics;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> reapTask;
    private volatile boolean closed;

    private FilterReaper(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics");

        if (builder.ttl == null || builder.ttl.isZero() || builder.ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
        if (builder.interval != null && (builder.interval.isZero() || builder.interval.isNegative())) {
            throw new IllegalArgumentException("interval must be > 0");
        }

        this.ttl = builder.ttl;
        this.interval = builder.interval != null ? builder.interval : builder.ttl;
        this.evictionListener = builder.evictionListener != null
                ? builder.evictionListener : filter -> { };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled reap loop. Subsequent calls are no-ops if already started.
     *
     * @throws IllegalStateException if the reaper has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("FilterReaper has been closed");
        }
        if (reapTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "filterstore-reaper");
            thread.setDaemon(true);
            return thread;
        });
        long delayNanos = interval.toNanos();
        reapTask = scheduler.scheduleWithFixedDelay(
                this::runCycle, delayNanos, delayNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Executes a single eviction cycle.
     *
     * <p>May be invoked directly for testing or one-off sweeps.
     *
     * @return the number of filters evicted by this call
     */
    public int runOnce() {
        if (closed) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(ttl);
        List<Filter> stale = store.notTakenSince(cutoff);
        int evicted = 0;
        for (Filter filter : stale) {
            if (evict(filter)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            metrics.incrementEvicted(evicted);
            logger.log(Level.INFO, "Evicted {0} filters not taken since {1}",
                    new Object[]{evicted, cutoff});
        }
        metrics.recordActiveFilters(store.size());
        return evicted;
    }

    private boolean evict(Filter filter) {
        try {
            store.remove(filter.id());
        } catch (FilterNotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to evict filter " + filter.id(), e);
            return false;
        }
        try {
            filter.clearSubChannel();
            evictionListener.onEvicted(filter);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Eviction cleanup failed for filter " + filter.id(), e);
        }
        return true;
    }

    private void runCycle() {
        try {
            runOnce();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Reap cycle failed", t);
        }
    }

    /** Cancels the reap schedule and shuts down the scheduler thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (reapTask != null) {
            reapTask.cancel(false);
            reapTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Builder for {@link FilterReaper}. */
    public static final class Builder {
        private FilterStore store;
        private Duration ttl = Duration.ofHours(24);
        private Duration interval;
        private Clock clock = Clock.systemUTC();
        private FilterEvictionListener evictionListener;
        private MetricsExporter metrics = MetricsExporter.NOOP;

        private Builder() {}

        /**
         * Sets the store to sweep.
         *
         * <p><b>Required.</b>
         *
         * @param store the filter store
         * @return this builder
         */
        public Builder store(FilterStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets how long a filter may go without its results being taken before
         * it is evicted.
         *
         * <p>Optional. Defaults to {@code 24 hours}. Must be &gt; 0.
         *
         * @param ttl the idle time-to-live
         * @return this builder
         */
        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        /**
         * Sets the delay between reap cycles.
         *
         * <p>Optional. Defaults to the ttl. Must be &gt; 0.
         *
         * @param interval delay between cycles
         * @return this builder
         */
        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        /**
         * Sets the clock used to compute the staleness cutoff.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets a callback notified for each evicted filter.
         *
         * <p>Optional.
         *
         * @param evictionListener the listener
         * @return this builder
         */
        public Builder evictionListener(FilterEvictionListener evictionListener) {
            this.evictionListener = evictionListener;
            return this;
        }

        /**
         * Sets the metrics exporter for eviction counts.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the reaper. Call {@link FilterReaper#start()} to begin.
         *
         * @return a new {@link FilterReaper} instance
         * @throws NullPointerException if {@code store} is null
         * @throws IllegalArgumentException if {@code ttl} or {@code interval} is not positive
         */
        public FilterReaper build() {
            return new FilterReaper(this);
        }
    }
}
