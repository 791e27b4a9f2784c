package io.filterstore.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FilterStorePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(FilterStoreProperties.class);
            assertEquals(100, props.getMaxFilters());
            assertTrue(props.getReaper().isEnabled());
            assertEquals(Duration.ofHours(24), props.getReaper().getTtl());
            assertNull(props.getReaper().getInterval());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("filterstore", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "filterstore.max-filters=5000",
                "filterstore.reaper.enabled=false",
                "filterstore.reaper.ttl=PT5M",
                "filterstore.reaper.interval=PT30S",
                "filterstore.metrics.enabled=false",
                "filterstore.metrics.name-prefix=eth.filters"
        ).run(ctx -> {
            var props = ctx.getBean(FilterStoreProperties.class);
            assertEquals(5000, props.getMaxFilters());
            assertFalse(props.getReaper().isEnabled());
            assertEquals(Duration.ofMinutes(5), props.getReaper().getTtl());
            assertEquals(Duration.ofSeconds(30), props.getReaper().getInterval());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("eth.filters", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(FilterStoreProperties.class)
    static class PropsConfig {
    }
}
