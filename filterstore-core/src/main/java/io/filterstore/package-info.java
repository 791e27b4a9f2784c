/**
 * Root API of the filter store: a bounded, thread-safe registry of active
 * subscriptions ("filters") that accumulate results until a consumer takes them.
 *
 * <h2>Core Design</h2>
 * <p>Each {@link io.filterstore.Filter} is identified by a 32-byte
 * {@link io.filterstore.FilterId} laid out like a hash, so ids travel through
 * hash-typed APIs unchanged. A {@linkplain io.filterstore.store.FilterStore store}
 * enforces id uniqueness and a capacity ceiling, and answers which filters have
 * gone unread since a given instant. The optional
 * {@linkplain io.filterstore.reaper.FilterReaper reaper} uses that query to evict
 * idle filters on a schedule.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>filterstore-core</b>: ids, store, reaper, metrics SPI (zero external deps)</li>
 *   <li><b>filterstore-micrometer</b>: optional Micrometer metrics bridge</li>
 *   <li><b>filterstore-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * FilterStore store = new MemFilterStore(100);
 * FilterId id = FilterIdGenerator.getDefault().newFilterId();
 * store.add(new MyEventFilter(id, criteria));
 *
 * try (FilterReaper reaper = FilterReaper.builder()
 *     .store(store)
 *     .ttl(Duration.ofMinutes(5))
 *     .evictionListener(filter -> eventIndex.uninstall(filter.id()))
 *     .build()) {
 *     reaper.start();
 *     // ...
 * }
 * }</pre>
 *
 * @see io.filterstore.Filter
 * @see io.filterstore.FilterId
 * @see io.filterstore.FilterIdGenerator
 * @see io.filterstore.store.FilterStore
 */
package io.filterstore;
