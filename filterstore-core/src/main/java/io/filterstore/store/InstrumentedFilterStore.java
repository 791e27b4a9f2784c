package io.filterstore.store;

import io.filterstore.Filter;
import io.filterstore.FilterId;
import io.filterstore.spi.MetricsExporter;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link FilterStore} decorator that reports every mutation to a {@link MetricsExporter}.
 *
 * <p>Errors from the delegate are counted and rethrown unchanged.
 */
public final class InstrumentedFilterStore implements FilterStore {
    private final FilterStore delegate;
    private final MetricsExporter metrics;

    public InstrumentedFilterStore(FilterStore delegate, MetricsExporter metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void add(Filter filter) {
        try {
            delegate.add(filter);
        } catch (FilterCapacityExceededException e) {
            metrics.incrementRejectedCapacity();
            throw e;
        } catch (FilterAlreadyRegisteredException e) {
            metrics.incrementRejectedDuplicate();
            throw e;
        }
        metrics.incrementAdded();
        metrics.recordActiveFilters(delegate.size());
    }

    @Override
    public Filter get(FilterId id) {
        return delegate.get(id);
    }

    @Override
    public void remove(FilterId id) {
        delegate.remove(id);
        metrics.incrementRemoved();
        metrics.recordActiveFilters(delegate.size());
    }

    @Override
    public List<Filter> notTakenSince(Instant when) {
        return delegate.notTakenSince(when);
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public int maxFilters() {
        return delegate.maxFilters();
    }
}
