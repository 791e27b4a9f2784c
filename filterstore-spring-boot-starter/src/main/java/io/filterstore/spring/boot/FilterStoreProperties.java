package io.filterstore.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the filter store.
 *
 * @see FilterStoreAutoConfiguration
 */
@ConfigurationProperties(prefix = "filterstore")
public class FilterStoreProperties {

    /**
     * Maximum number of filters registered at the same time.
     */
    private int maxFilters = 100;

    private final Reaper reaper = new Reaper();
    private final Metrics metrics = new Metrics();

    public int getMaxFilters() {
        return maxFilters;
    }

    public void setMaxFilters(int maxFilters) {
        this.maxFilters = maxFilters;
    }

    public Reaper getReaper() {
        return reaper;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Reaper {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(24);
        /**
         * Delay between reap cycles; the ttl is used when unset.
         */
        private Duration interval;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "filterstore";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
