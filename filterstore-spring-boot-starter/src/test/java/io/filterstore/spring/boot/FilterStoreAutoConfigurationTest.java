package io.filterstore.spring.boot;

import io.filterstore.Filter;
import io.filterstore.FilterId;
import io.filterstore.FilterIdGenerator;
import io.filterstore.ResultSink;
import io.filterstore.reaper.FilterEvictionListener;
import io.filterstore.reaper.FilterReaper;
import io.filterstore.spi.MetricsExporter;
import io.filterstore.store.FilterStore;
import io.filterstore.store.InstrumentedFilterStore;
import io.filterstore.store.MemFilterStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class FilterStoreAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FilterStoreAutoConfiguration.class));

    @Test
    void createsAllBeans() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("filterIdGenerator"));
            assertTrue(ctx.containsBean("filterStore"));
            assertTrue(ctx.containsBean("filterReaper"));

            assertInstanceOf(MemFilterStore.class, ctx.getBean(FilterStore.class));
            assertSame(FilterIdGenerator.getDefault(), ctx.getBean(FilterIdGenerator.class));
            assertEquals(100, ctx.getBean(FilterStore.class).maxFilters());
        });
    }

    @Test
    void maxFiltersFromProperties() {
        runner.withPropertyValues("filterstore.max-filters=7").run(ctx ->
                assertEquals(7, ctx.getBean(FilterStore.class).maxFilters()));
    }

    @Test
    void negativeMaxFiltersFailsStartup() {
        runner.withPropertyValues("filterstore.max-filters=-1").run(ctx -> {
            assertNotNull(ctx.getStartupFailure());
            assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
    }

    @Test
    void reaperCanBeDisabled() {
        runner.withPropertyValues("filterstore.reaper.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("filterReaper"));
            assertTrue(ctx.containsBean("filterStore"));
        });
    }

    @Test
    void storeIsInstrumentedWhenMetricsExporterPresent() {
        runner.withUserConfiguration(MetricsConfig.class).run(ctx ->
                assertInstanceOf(InstrumentedFilterStore.class, ctx.getBean(FilterStore.class)));
    }

    @Test
    void backsOffWhenCustomStorePresent() {
        runner.withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
            FilterStore store = ctx.getBean(FilterStore.class);
            assertInstanceOf(MemFilterStore.class, store);
            assertEquals(3, store.maxFilters());
        });
    }

    @Test
    void reaperNotifiesEvictionListenerBeans() {
        runner.withUserConfiguration(ListenerConfig.class)
                .withPropertyValues("filterstore.reaper.ttl=PT1M", "filterstore.reaper.interval=PT1H")
                .run(ctx -> {
                    FilterStore store = ctx.getBean(FilterStore.class);
                    FilterId id = ctx.getBean(FilterIdGenerator.class).newFilterId();
                    store.add(new IdleFilter(id));

                    assertEquals(1, ctx.getBean(FilterReaper.class).runOnce());

                    assertEquals(List.of(id), ctx.getBean(RecordingListener.class).evicted);
                    assertEquals(0, store.size());
                });
    }

    private static Throwable findRootCause(Throwable t) {
        while (t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    @Configuration
    static class MetricsConfig {
        @Bean
        MetricsExporter metricsExporter() {
            return MetricsExporter.NOOP;
        }
    }

    @Configuration
    static class CustomStoreConfig {
        @Bean
        FilterStore customFilterStore() {
            return new MemFilterStore(3);
        }
    }

    @Configuration
    static class ListenerConfig {
        @Bean
        RecordingListener recordingListener() {
            return new RecordingListener();
        }
    }

    static final class RecordingListener implements FilterEvictionListener {
        final List<FilterId> evicted = new CopyOnWriteArrayList<>();

        @Override
        public void onEvicted(Filter filter) {
            evicted.add(filter.id());
        }
    }

    private static final class IdleFilter implements Filter {
        private final FilterId id;

        IdleFilter(FilterId id) {
            this.id = id;
        }

        @Override
        public FilterId id() {
            return id;
        }

        @Override
        public Instant lastTaken() {
            return Instant.EPOCH;
        }

        @Override
        public void setSubChannel(ResultSink sink) {
        }

        @Override
        public void clearSubChannel() {
        }
    }
}
