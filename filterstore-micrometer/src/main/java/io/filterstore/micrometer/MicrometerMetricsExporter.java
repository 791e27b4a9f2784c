package io.filterstore.micrometer;

import io.filterstore.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code filterstore.added}: filters registered</li>
 *   <li>{@code filterstore.removed}: filters deregistered</li>
 *   <li>{@code filterstore.rejected.capacity}: registrations rejected, store full</li>
 *   <li>{@code filterstore.rejected.duplicate}: registrations rejected, id taken</li>
 *   <li>{@code filterstore.evicted}: filters evicted by the reaper</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code filterstore.active}: currently registered filters</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter added;
    private final Counter removed;
    private final Counter rejectedCapacity;
    private final Counter rejectedDuplicate;
    private final Counter evicted;
    private final Gauge activeGauge;

    private final AtomicInteger active = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "filterstore"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "filterstore");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-store use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "eth.filters"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.added = Counter.builder(namePrefix + ".added")
                .description("Filters registered")
                .register(registry);
        this.removed = Counter.builder(namePrefix + ".removed")
                .description("Filters deregistered")
                .register(registry);
        this.rejectedCapacity = Counter.builder(namePrefix + ".rejected.capacity")
                .description("Registrations rejected because the store was full")
                .register(registry);
        this.rejectedDuplicate = Counter.builder(namePrefix + ".rejected.duplicate")
                .description("Registrations rejected because the id was already registered")
                .register(registry);
        this.evicted = Counter.builder(namePrefix + ".evicted")
                .description("Filters evicted for not being taken within the ttl")
                .register(registry);
        this.activeGauge = Gauge.builder(namePrefix + ".active", active, AtomicInteger::get)
                .description("Currently registered filters")
                .register(registry);
    }

    @Override
    public void incrementAdded() {
        if (closed) return;
        added.increment();
    }

    @Override
    public void incrementRemoved() {
        if (closed) return;
        removed.increment();
    }

    @Override
    public void incrementRejectedCapacity() {
        if (closed) return;
        rejectedCapacity.increment();
    }

    @Override
    public void incrementRejectedDuplicate() {
        if (closed) return;
        rejectedDuplicate.increment();
    }

    @Override
    public void incrementEvicted(int count) {
        if (closed) return;
        evicted.increment(count);
    }

    @Override
    public void recordActiveFilters(int count) {
        if (closed) return;
        active.set(count);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the store is discarded to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(added, removed, rejectedCapacity, rejectedDuplicate,
                evicted, activeGauge)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
