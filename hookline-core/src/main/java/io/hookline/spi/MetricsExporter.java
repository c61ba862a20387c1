package io.hookline.spi;

/**
 * Observability hook for exporting delivery counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see io.hookline.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events accepted by intake.
     */
    void incrementEventsTriggered();

    /**
     * Increments the count of delivery tasks accepted by the dispatcher queue.
     */
    void incrementDeliveryEnqueued();

    /**
     * Increments the count of delivery tasks rejected because the queue stayed full.
     */
    void incrementDeliveryRejected();

    /**
     * Increments the count of delivery attempts answered with a 2xx.
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of failed delivery attempts (non-2xx, timeout, network error).
     */
    void incrementDeliveryFailure();

    /**
     * Increments the count of delivery tasks that used up every attempt.
     */
    void incrementDeliveryExhausted();

    /**
     * Increments the count of successful verification handshakes.
     */
    default void incrementHandshakeSuccess() {
    }

    /**
     * Increments the count of failed verification handshakes.
     */
    default void incrementHandshakeFailure() {
    }

    /**
     * Records the current depth of the delivery queue.
     *
     * @param depth number of queued tasks
     */
    void recordQueueDepth(int depth);

    /**
     * Records the duration of one delivery attempt, network call included.
     *
     * @param durationMs attempt duration in milliseconds (always non-negative)
     */
    default void recordDeliveryDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEventsTriggered() {
        }

        @Override
        public void incrementDeliveryEnqueued() {
        }

        @Override
        public void incrementDeliveryRejected() {
        }

        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void incrementDeliveryExhausted() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
