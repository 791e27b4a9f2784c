package io.filterstore.store;

import io.filterstore.Filter;
import io.filterstore.FilterId;

import java.time.Instant;
import java.util.List;

/**
 * Registry of active filters keyed by {@link FilterId}.
 *
 * <p>The store only tracks membership. Filters are created elsewhere and shared
 * with the code that feeds them results; the store never mutates them. Eviction
 * policy also lives elsewhere: {@link #notTakenSince(Instant)} lets a reaper find
 * idle filters, which it then removes with {@link #remove(FilterId)}.
 *
 * <p>All operations fail fast with a {@link FilterStoreException} subclass and
 * never retry.
 *
 * @see MemFilterStore
 * @see io.filterstore.reaper.FilterReaper
 */
public interface FilterStore {

    /**
     * Registers a filter under its {@link Filter#id() id}.
     *
     * <p>Capacity is checked before uniqueness.
     *
     * @param filter the filter to register
     * @throws FilterCapacityExceededException if the store is full
     * @throws FilterAlreadyRegisteredException if the id is already registered
     */
    void add(Filter filter);

    /**
     * Looks up a registered filter.
     *
     * @param id the filter id
     * @return the registered filter
     * @throws FilterNotFoundException if no filter has this id
     */
    Filter get(FilterId id);

    /**
     * Deregisters a filter.
     *
     * @param id the filter id
     * @throws FilterNotFoundException if no filter has this id; the store is left unchanged
     */
    void remove(FilterId id);

    /**
     * Returns the filters whose results have not been taken since {@code when},
     * i.e. whose {@link Filter#lastTaken()} is strictly before it.
     *
     * @param when the staleness cutoff
     * @return unmodifiable list in no particular order, may be empty
     */
    List<Filter> notTakenSince(Instant when);

    /**
     * Returns the number of registered filters.
     *
     * @return current filter count
     */
    int size();

    /**
     * Returns the maximum number of filters this store accepts.
     *
     * @return capacity ceiling
     */
    int maxFilters();
}
