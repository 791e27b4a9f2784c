package io.filterstore;

import java.time.Instant;

/**
 * A subscription that accumulates matching results until a consumer takes them.
 *
 * <p>Implementations live outside this library. The store only holds references
 * and reads {@link #lastTaken()} during staleness scans; everything else is driven
 * by the code that created the filter.
 *
 * @see io.filterstore.store.FilterStore
 */
public interface Filter {

    /**
     * Returns the identifier of this filter. Must not change for the lifetime of the filter.
     *
     * @return the filter id
     */
    FilterId id();

    /**
     * Returns the last time the accumulated results were collected by a consumer.
     *
     * <p>May be called at any time from any thread.
     *
     * @return the last-taken instant
     */
    Instant lastTaken();

    /**
     * Attaches an output for pushing live results to a subscriber.
     *
     * @param sink the subscriber output
     */
    void setSubChannel(ResultSink sink);

    /**
     * Detaches the subscriber output, if any.
     */
    void clearSubChannel();
}
