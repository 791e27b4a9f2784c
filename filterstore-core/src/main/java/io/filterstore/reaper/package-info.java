/**
 * Scheduled eviction of idle filters.
 *
 * <p>{@link io.filterstore.reaper.FilterReaper} periodically removes filters whose
 * results have not been taken within a configurable time-to-live, so subscribers
 * that stopped polling do not hold capacity forever.
 *
 * @see io.filterstore.reaper.FilterReaper
 * @see io.filterstore.store.FilterStore#notTakenSince(java.time.Instant)
 */
package io.filterstore.reaper;
