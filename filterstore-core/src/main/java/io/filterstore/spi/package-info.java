/**
 * Service provider interfaces for plugging the filter store into its host.
 *
 * <p>{@link io.filterstore.spi.MetricsExporter} receives store and reaper counters;
 * the {@code filterstore-micrometer} module provides a Micrometer implementation.
 */
package io.filterstore.spi;
