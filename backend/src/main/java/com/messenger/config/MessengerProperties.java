package com.messenger.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables bound from {@code messenger.*}.
 *
 * Defaults match application.yml so that unit tests can build the object directly.
 */
@ConfigurationProperties(prefix = "messenger")
public class MessengerProperties {

    private final Retry retry = new Retry();
    private final Fanout fanout = new Fanout();
    private final Paging paging = new Paging();
    private final Cursor cursor = new Cursor();
    private final Repair repair = new Repair();

    public Retry getRetry() { return retry; }
    public Fanout getFanout() { return fanout; }
    public Paging getPaging() { return paging; }
    public Cursor getCursor() { return cursor; }
    public Repair getRepair() { return repair; }

    /** Bounded backoff applied to every storage step independently. */
    public static class Retry {
        private int maxRetries = 3;
        private Duration minBackoff = Duration.ofMillis(50);
        private Duration maxBackoff = Duration.ofSeconds(1);

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getMinBackoff() { return minBackoff; }
        public void setMinBackoff(Duration minBackoff) { this.minBackoff = minBackoff; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    public static class Fanout {
        /** Upper bound for one catalog/directory step before it is handed to repair. */
        private Duration timeout = Duration.ofSeconds(2);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Paging {
        private int defaultLimit = 20;
        private int maxLimit = 100;

        public int getDefaultLimit() { return defaultLimit; }
        public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }
        public int getMaxLimit() { return maxLimit; }
        public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }

        /** Null falls back to the default; anything else is clamped to {@code [1, maxLimit]}. */
        public int clamp(Integer requested) {
            if (requested == null) {
                return defaultLimit;
            }
            return Math.max(1, Math.min(requested, maxLimit));
        }
    }

    public static class Cursor {
        private String secret = "change-me";

        public String getSecret() { return secret; }
        public void setSecret(String secret) { this.secret = secret; }
    }

    public static class Repair {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);
        private int buckets = 16;
        private int batchSize = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public int getBuckets() { return buckets; }
        public void setBuckets(int buckets) { this.buckets = buckets; }
        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }
}
