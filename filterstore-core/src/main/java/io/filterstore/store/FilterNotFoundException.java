package io.filterstore.store;

import io.filterstore.FilterId;

/**
 * Thrown when an operation references an id that is not registered.
 *
 * <p>Usually surfaced to the end user as an unknown subscription.
 */
public final class FilterNotFoundException extends FilterStoreException {
    private final FilterId filterId;

    public FilterNotFoundException(FilterId filterId) {
        super("filter not found");
        this.filterId = filterId;
    }

    public FilterId filterId() {
        return filterId;
    }
}
