/**
 * Micrometer bridge for exporting filter store metrics.
 *
 * @see io.filterstore.micrometer.MicrometerMetricsExporter
 */
package io.filterstore.micrometer;
