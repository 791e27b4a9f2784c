/**
 * Spring Boot auto-configuration for the filter store.
 *
 * <p>{@link io.filterstore.spring.boot.FilterStoreAutoConfiguration} wires a
 * {@link io.filterstore.store.FilterStore} and a
 * {@link io.filterstore.reaper.FilterReaper} from {@code filterstore.*} application
 * properties. Declare {@link io.filterstore.reaper.FilterEvictionListener} beans to
 * react to evictions.
 *
 * @see io.filterstore.spring.boot.FilterStoreAutoConfiguration
 * @see io.filterstore.spring.boot.FilterStoreProperties
 */
package io.filterstore.spring.boot;
