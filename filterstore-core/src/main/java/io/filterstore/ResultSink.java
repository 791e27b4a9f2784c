package io.filterstore;

/**
 * Output attached to a {@link Filter} for pushing live results to a subscriber.
 *
 * <p>Implementations must be thread-safe if the filter delivers from more than
 * one thread.
 */
@FunctionalInterface
public interface ResultSink {

    /**
     * Delivers one result to the subscriber.
     *
     * @param result the matched result
     */
    void deliver(Object result);
}
