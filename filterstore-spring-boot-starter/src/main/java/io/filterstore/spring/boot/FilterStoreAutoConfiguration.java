package io.filterstore.spring.boot;

import io.filterstore.FilterIdGenerator;
import io.filterstore.reaper.FilterEvictionListener;
import io.filterstore.reaper.FilterReaper;
import io.filterstore.spi.MetricsExporter;
import io.filterstore.store.FilterStore;
import io.filterstore.store.InstrumentedFilterStore;
import io.filterstore.store.MemFilterStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the filter store.
 *
 * <p>Provides a {@link MemFilterStore} sized from {@code filterstore.max-filters},
 * instrumented when a {@link MetricsExporter} bean is present, the default
 * {@link FilterIdGenerator}, and a started {@link FilterReaper} that notifies every
 * {@link FilterEvictionListener} bean.
 *
 * @see FilterStoreProperties
 * @see FilterStoreMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(FilterStore.class)
@EnableConfigurationProperties(FilterStoreProperties.class)
public class FilterStoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FilterIdGenerator filterIdGenerator() {
        return FilterIdGenerator.getDefault();
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterStore filterStore(FilterStoreProperties props,
                                   ObjectProvider<MetricsExporter> metricsProvider) {
        FilterStore store = new MemFilterStore(props.getMaxFilters());
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        return metrics != null ? new InstrumentedFilterStore(store, metrics) : store;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "filterstore.reaper", name = "enabled", matchIfMissing = true)
    public FilterReaper filterReaper(FilterStoreProperties props,
                                     FilterStore filterStore,
                                     ObjectProvider<MetricsExporter> metricsProvider,
                                     ObjectProvider<FilterEvictionListener> listenerProvider) {
        List<FilterEvictionListener> listeners = listenerProvider.orderedStream().toList();
        var builder = FilterReaper.builder()
                .store(filterStore)
                .ttl(props.getReaper().getTtl())
                .interval(props.getReaper().getInterval());
        if (!listeners.isEmpty()) {
            builder.evictionListener(filter -> listeners.forEach(l -> l.onEvicted(filter)));
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        FilterReaper reaper = builder.build();
        reaper.start();
        return reaper;
    }
}
