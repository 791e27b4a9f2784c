package io.filterstore.store;

/**
 * Thrown by {@link FilterStore#add} when the store already holds its maximum
 * number of filters. Capacity frees up only when filters are removed.
 */
public final class FilterCapacityExceededException extends FilterStoreException {
    private final int maxFilters;

    public FilterCapacityExceededException(int maxFilters) {
        super("maximum number of filters registered");
        this.maxFilters = maxFilters;
    }

    public int maxFilters() {
        return maxFilters;
    }
}
