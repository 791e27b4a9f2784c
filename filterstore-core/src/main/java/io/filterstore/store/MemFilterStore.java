package io.filterstore.store;

import io.filterstore.Filter;
import io.filterstore.FilterId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link FilterStore} with a fixed capacity.
 *
 * <p>A single lock guards the whole map and is held for the full duration of
 * every operation, so operations are linearizable. No operation blocks on
 * anything but that lock.
 *
 * <p>The capacity is enforced at registration time only.
 *
 * <p>This class is thread-safe.
 */
public final class MemFilterStore implements FilterStore {
    private final int maxFilters;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<FilterId, Filter> filters = new HashMap<>();

    /**
     * Creates an empty store.
     *
     * @param maxFilters maximum number of registered filters; zero rejects every add
     * @throws IllegalArgumentException if {@code maxFilters} is negative
     */
    public MemFilterStore(int maxFilters) {
        if (maxFilters < 0) {
            throw new IllegalArgumentException("maxFilters must be >= 0");
        }
        this.maxFilters = maxFilters;
    }

    @Override
    public void add(Filter filter) {
        Objects.requireNonNull(filter, "filter");
        FilterId id = Objects.requireNonNull(filter.id(), "filter.id()");
        lock.lock();
        try {
            if (filters.size() >= maxFilters) {
                throw new FilterCapacityExceededException(maxFilters);
            }
            if (filters.containsKey(id)) {
                throw new FilterAlreadyRegisteredException(id);
            }
            filters.put(id, filter);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Filter get(FilterId id) {
        Objects.requireNonNull(id, "id");
        Filter filter;
        lock.lock();
        try {
            filter = filters.get(id);
        } finally {
            lock.unlock();
        }
        if (filter == null) {
            throw new FilterNotFoundException(id);
        }
        return filter;
    }

    @Override
    public void remove(FilterId id) {
        Objects.requireNonNull(id, "id");
        lock.lock();
        try {
            if (filters.remove(id) == null) {
                throw new FilterNotFoundException(id);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Filter> notTakenSince(Instant when) {
        Objects.requireNonNull(when, "when");
        List<Filter> result = new ArrayList<>();
        lock.lock();
        try {
            for (Filter filter : filters.values()) {
                if (filter.lastTaken().isBefore(when)) {
                    result.add(filter);
                }
            }
        } finally {
            lock.unlock();
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return filters.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int maxFilters() {
        return maxFilters;
    }
}
