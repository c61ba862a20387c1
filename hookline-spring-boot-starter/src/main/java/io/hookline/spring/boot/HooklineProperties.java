package io.hookline.spring.boot;

import io.hookline.jdbc.TableNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for hookline.
 *
 * @see HooklineAutoConfiguration
 */
@ConfigurationProperties(prefix = "hookline")
public class HooklineProperties {

    /**
     * Table holding webhook subscriptions.
     */
    private String subscriptionTable = TableNames.DEFAULT_SUBSCRIPTION_TABLE;

    /**
     * Table holding triggered events.
     */
    private String eventTable = TableNames.DEFAULT_EVENT_TABLE;

    /**
     * Allows loopback and private-network target URLs. Keep off in production.
     */
    private boolean allowPrivateTargets = false;

    /**
     * Consecutive failed attempts after which a subscription is marked failed.
     */
    private int failureCeiling = 10;

    /**
     * Overrides the User-Agent header sent with deliveries and handshakes.
     */
    private String userAgent;

    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final Verification verification = new Verification();
    private final Retention retention = new Retention();
    private final Metrics metrics = new Metrics();

    public String getSubscriptionTable() {
        return subscriptionTable;
    }

    public void setSubscriptionTable(String subscriptionTable) {
        this.subscriptionTable = subscriptionTable;
    }

    public String getEventTable() {
        return eventTable;
    }

    public void setEventTable(String eventTable) {
        this.eventTable = eventTable;
    }

    public boolean isAllowPrivateTargets() {
        return allowPrivateTargets;
    }

    public void setAllowPrivateTargets(boolean allowPrivateTargets) {
        this.allowPrivateTargets = allowPrivateTargets;
    }

    public int getFailureCeiling() {
        return failureCeiling;
    }

    public void setFailureCeiling(int failureCeiling) {
        this.failureCeiling = failureCeiling;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public Verification getVerification() {
        return verification;
    }

    public Retention getRetention() {
        return retention;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatcher {
        private int workerCount = 4;
        private int queueCapacity = 1000;
        private long enqueueTimeoutMs = 100;
        private long drainTimeoutMs = 5000;
        private Duration requestTimeout = Duration.ofSeconds(10);

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public long getEnqueueTimeoutMs() {
            return enqueueTimeoutMs;
        }

        public void setEnqueueTimeoutMs(long enqueueTimeoutMs) {
            this.enqueueTimeoutMs = enqueueTimeoutMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Retry {
        private int maxAttempts = 5;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 300_000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Verification {
        private int handshakeThreads = 2;
        private long signatureToleranceSeconds = 300;
        private Duration pendingTimeout = Duration.ofDays(30);

        public int getHandshakeThreads() {
            return handshakeThreads;
        }

        public void setHandshakeThreads(int handshakeThreads) {
            this.handshakeThreads = handshakeThreads;
        }

        public long getSignatureToleranceSeconds() {
            return signatureToleranceSeconds;
        }

        public void setSignatureToleranceSeconds(long signatureToleranceSeconds) {
            this.signatureToleranceSeconds = signatureToleranceSeconds;
        }

        public Duration getPendingTimeout() {
            return pendingTimeout;
        }

        public void setPendingTimeout(Duration pendingTimeout) {
            this.pendingTimeout = pendingTimeout;
        }
    }

    public static class Retention {
        private boolean enabled = true;
        private Duration eventRetention = Duration.ofDays(90);
        private int batchSize = 500;
        private long intervalSeconds = 86_400;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getEventRetention() {
            return eventRetention;
        }

        public void setEventRetention(Duration eventRetention) {
            this.eventRetention = eventRetention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "hookline";

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
