package io.filterstore.spring.boot;

import io.filterstore.micrometer.MicrometerMetricsExporter;
import io.filterstore.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code filterstore.metrics.enabled} is true
 * (default).
 *
 * <p>Runs after the actuator's meter registry auto-configuration, so a Boot-provided
 * {@link MeterRegistry} is visible, and before {@link FilterStoreAutoConfiguration} so
 * the {@link MetricsExporter} bean is available to the store and the reaper.
 */
@AutoConfiguration(before = FilterStoreAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "filterstore.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(FilterStoreProperties.class)
public class FilterStoreMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(
            MeterRegistry meterRegistry, FilterStoreProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
