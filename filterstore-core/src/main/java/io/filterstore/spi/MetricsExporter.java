package io.filterstore.spi;

/**
 * Observability hook for exporting filter store counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of filters registered successfully.
     */
    void incrementAdded();

    /**
     * Increments the count of filters deregistered.
     */
    void incrementRemoved();

    /**
     * Increments the count of registrations rejected because the store was full.
     */
    void incrementRejectedCapacity();

    /**
     * Increments the count of registrations rejected because the id was taken.
     */
    void incrementRejectedDuplicate();

    /**
     * Adds to the count of filters evicted by the reaper.
     *
     * @param count number of filters evicted in one cycle
     */
    void incrementEvicted(int count);

    /**
     * Records the current number of registered filters.
     *
     * @param count active filter count
     */
    void recordActiveFilters(int count);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementAdded() {
        }

        @Override
        public void incrementRemoved() {
        }

        @Override
        public void incrementRejectedCapacity() {
        }

        @Override
        public void incrementRejectedDuplicate() {
        }

        @Override
        public void incrementEvicted(int count) {
        }

        @Override
        public void recordActiveFilters(int count) {
        }
    }
}
