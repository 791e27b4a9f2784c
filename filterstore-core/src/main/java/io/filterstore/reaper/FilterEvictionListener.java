package io.filterstore.reaper;

import io.filterstore.Filter;

/**
 * Callback invoked after the reaper has evicted a stale filter.
 *
 * <p>Typical use is releasing resources tied to the filter elsewhere, such as
 * uninstalling it from the component that feeds it results.
 */
@FunctionalInterface
public interface FilterEvictionListener {

    /**
     * Called once per evicted filter, on the reaper thread.
     *
     * @param filter the filter that was removed from the store
     */
    void onEvicted(Filter filter);
}
