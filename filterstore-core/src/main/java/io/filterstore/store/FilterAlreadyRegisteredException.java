package io.filterstore.store;

import io.filterstore.FilterId;

/**
 * Thrown by {@link FilterStore#add} when a filter with the same id is already registered.
 */
public final class FilterAlreadyRegisteredException extends FilterStoreException {
    private final FilterId filterId;

    public FilterAlreadyRegisteredException(FilterId filterId) {
        super("filter already registered");
        this.filterId = filterId;
    }

    public FilterId filterId() {
        return filterId;
    }
}
