/**
 * The filter registry: {@link io.filterstore.store.FilterStore}, its in-memory
 * implementation and its error types.
 *
 * <p>{@link io.filterstore.store.MemFilterStore} guards its map with a single lock,
 * so every operation is atomic with respect to the others. Wrap it in
 * {@link io.filterstore.store.InstrumentedFilterStore} to export metrics.
 *
 * @see io.filterstore.store.FilterStore
 * @see io.filterstore.store.FilterStoreException
 */
package io.filterstore.store;
