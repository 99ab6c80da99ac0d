package com.relaybox.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Outbox outbox = new Outbox();
    private Cursor cursor = new Cursor();
    private Dispatcher dispatcher = new Dispatcher();
    private Queue queue = new Queue();
    private Retention retention = new Retention();
    private Maintenance maintenance = new Maintenance();
    private Relay relay = new Relay();

    public Outbox getOutbox() {
        return outbox;
    }

    public void setOutbox(Outbox outbox) {
        this.outbox = outbox;
    }

    public Cursor getCursor() {
        return cursor;
    }

    public void setCursor(Cursor cursor) {
        this.cursor = cursor;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public void setDispatcher(Dispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Maintenance getMaintenance() {
        return maintenance;
    }

    public void setMaintenance(Maintenance maintenance) {
        this.maintenance = maintenance;
    }

    public Relay getRelay() {
        return relay;
    }

    public void setRelay(Relay relay) {
        this.relay = relay;
    }

    public static class Outbox {
        private String channel = "outbox_events";
        private int batchSize = 100;

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    /** Per-consumer cursor lock and drain tuning. */
    public static class Cursor {
        private long lockDurationMs = 10000;
        private long refreshIntervalMs = 5000;
        private int maxRetries = 5;
        private long baseBackoffMs = 1000;
        private long maxBackoffMs = 300000;
        private long gapWindowMs = 1000;
        private long clockDriftPadMs = 100;
        private long debounceMs = 50;
        private long maxWaitMs = 200;
        private int drainPoolSize = 4;

        public long getLockDurationMs() {
            return lockDurationMs;
        }

        public void setLockDurationMs(long lockDurationMs) {
            this.lockDurationMs = lockDurationMs;
        }

        public long getRefreshIntervalMs() {
            return refreshIntervalMs;
        }

        public void setRefreshIntervalMs(long refreshIntervalMs) {
            this.refreshIntervalMs = refreshIntervalMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBaseBackoffMs() {
            return baseBackoffMs;
        }

        public void setBaseBackoffMs(long baseBackoffMs) {
            this.baseBackoffMs = baseBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public long getGapWindowMs() {
            return gapWindowMs;
        }

        public void setGapWindowMs(long gapWindowMs) {
            this.gapWindowMs = gapWindowMs;
        }

        public long getClockDriftPadMs() {
            return clockDriftPadMs;
        }

        public void setClockDriftPadMs(long clockDriftPadMs) {
            this.clockDriftPadMs = clockDriftPadMs;
        }

        public long getDebounceMs() {
            return debounceMs;
        }

        public void setDebounceMs(long debounceMs) {
            this.debounceMs = debounceMs;
        }

        public long getMaxWaitMs() {
            return maxWaitMs;
        }

        public void setMaxWaitMs(long maxWaitMs) {
            this.maxWaitMs = maxWaitMs;
        }

        public int getDrainPoolSize() {
            return drainPoolSize;
        }

        public void setDrainPoolSize(int drainPoolSize) {
            this.drainPoolSize = drainPoolSize;
        }
    }

    public static class Dispatcher {
        private boolean enabled = true;
        private long fallbackPollMs = 2000;
        private long keepaliveMs = 30000;
        private long reconnectInitialMs = 1000;
        private long reconnectMaxMs = 30000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getFallbackPollMs() {
            return fallbackPollMs;
        }

        public void setFallbackPollMs(long fallbackPollMs) {
            this.fallbackPollMs = fallbackPollMs;
        }

        public long getKeepaliveMs() {
            return keepaliveMs;
        }

        public void setKeepaliveMs(long keepaliveMs) {
            this.keepaliveMs = keepaliveMs;
        }

        public long getReconnectInitialMs() {
            return reconnectInitialMs;
        }

        public void setReconnectInitialMs(long reconnectInitialMs) {
            this.reconnectInitialMs = reconnectInitialMs;
        }

        public long getReconnectMaxMs() {
            return reconnectMaxMs;
        }

        public void setReconnectMaxMs(long reconnectMaxMs) {
            this.reconnectMaxMs = reconnectMaxMs;
        }
    }

    public static class Queue {
        private boolean enabled = true;
        private long lockDurationMs = 10000;
        private long refreshIntervalMs = 5000;
        private int maxRetries = 5;
        private long baseBackoffMs = 500;
        private long maxBackoffMs = 300000;
        private int claimBatchSize = 20;
        private int processingConcurrency = 5;
        private long pollIntervalMs = 500;
        private long refillDebounceMs = 100;
        private int maxActiveTokens = 5;
        private int cronLeaseLimit = 10;
        private int cronLookaheadSeconds = 60;
        private long shutdownTimeoutMs = 30000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getLockDurationMs() {
            return lockDurationMs;
        }

        public void setLockDurationMs(long lockDurationMs) {
            this.lockDurationMs = lockDurationMs;
        }

        public long getRefreshIntervalMs() {
            return refreshIntervalMs;
        }

        public void setRefreshIntervalMs(long refreshIntervalMs) {
            this.refreshIntervalMs = refreshIntervalMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBaseBackoffMs() {
            return baseBackoffMs;
        }

        public void setBaseBackoffMs(long baseBackoffMs) {
            this.baseBackoffMs = baseBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public int getClaimBatchSize() {
            return claimBatchSize;
        }

        public void setClaimBatchSize(int claimBatchSize) {
            this.claimBatchSize = claimBatchSize;
        }

        public int getProcessingConcurrency() {
            return processingConcurrency;
        }

        public void setProcessingConcurrency(int processingConcurrency) {
            this.processingConcurrency = processingConcurrency;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getRefillDebounceMs() {
            return refillDebounceMs;
        }

        public void setRefillDebounceMs(long refillDebounceMs) {
            this.refillDebounceMs = refillDebounceMs;
        }

        public int getMaxActiveTokens() {
            return maxActiveTokens;
        }

        public void setMaxActiveTokens(int maxActiveTokens) {
            this.maxActiveTokens = maxActiveTokens;
        }

        public int getCronLeaseLimit() {
            return cronLeaseLimit;
        }

        public void setCronLeaseLimit(int cronLeaseLimit) {
            this.cronLeaseLimit = cronLeaseLimit;
        }

        public int getCronLookaheadSeconds() {
            return cronLookaheadSeconds;
        }

        public void setCronLookaheadSeconds(int cronLookaheadSeconds) {
            this.cronLookaheadSeconds = cronLookaheadSeconds;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }
    }

    /** Event log retention. {@code consumerIds} is the set whose cursors bound deletion. */
    public static class Retention {
        private boolean enabled = true;
        private long intervalMs = 3600000;
        private int retentionHours = 168;
        private int batchSize = 1000;
        private int maxBatchesPerRun = 5;
        private List<String> consumerIds = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getRetentionHours() {
            return retentionHours;
        }

        public void setRetentionHours(int retentionHours) {
            this.retentionHours = retentionHours;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxBatchesPerRun() {
            return maxBatchesPerRun;
        }

        public void setMaxBatchesPerRun(int maxBatchesPerRun) {
            this.maxBatchesPerRun = maxBatchesPerRun;
        }

        public List<String> getConsumerIds() {
            return consumerIds;
        }

        public void setConsumerIds(List<String> consumerIds) {
            this.consumerIds = consumerIds;
        }
    }

    public static class Maintenance {
        private boolean enabled = true;
        private long intervalMs = 600000;
        private int completedRetentionHours = 24;
        private int deadLetterRetentionHours = 336;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getCompletedRetentionHours() {
            return completedRetentionHours;
        }

        public void setCompletedRetentionHours(int completedRetentionHours) {
            this.completedRetentionHours = completedRetentionHours;
        }

        public int getDeadLetterRetentionHours() {
            return deadLetterRetentionHours;
        }

        public void setDeadLetterRetentionHours(int deadLetterRetentionHours) {
            this.deadLetterRetentionHours = deadLetterRetentionHours;
        }
    }

    /** Event type wire name to queue name, for the built-in job dispatch consumer. */
    public static class Relay {
        private boolean enabled = true;
        private Map<String, String> routes = new LinkedHashMap<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Map<String, String> getRoutes() {
            return routes;
        }

        public void setRoutes(Map<String, String> routes) {
            this.routes = routes;
        }
    }
}
