package io.hookline.micrometer;

import io.hookline.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code hookline.events.triggered} - events accepted by intake</li>
 *   <li>{@code hookline.delivery.enqueued} - delivery tasks queued</li>
 *   <li>{@code hookline.delivery.rejected} - tasks parked because the queue was full</li>
 *   <li>{@code hookline.delivery.success} - attempts answered with 2xx</li>
 *   <li>{@code hookline.delivery.failure} - failed attempts</li>
 *   <li>{@code hookline.delivery.exhausted} - tasks that ran out of attempts</li>
 *   <li>{@code hookline.handshake.success} / {@code hookline.handshake.failure}</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code hookline.queue.depth} - current delivery queue depth</li>
 *   <li>{@code hookline.delivery.duration} - time per delivery attempt</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter eventsTriggered;
  private final Counter deliveryEnqueued;
  private final Counter deliveryRejected;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter deliveryExhausted;
  private final Counter handshakeSuccess;
  private final Counter handshakeFailure;
  private final Timer deliveryDuration;
  private final Gauge queueDepthGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "hookline");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.hookline"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.eventsTriggered = counter(namePrefix + ".events.triggered", "Events accepted by intake");
    this.deliveryEnqueued = counter(namePrefix + ".delivery.enqueued", "Delivery tasks queued");
    this.deliveryRejected = counter(namePrefix + ".delivery.rejected", "Delivery tasks parked (queue full)");
    this.deliverySuccess = counter(namePrefix + ".delivery.success", "Delivery attempts answered with 2xx");
    this.deliveryFailure = counter(namePrefix + ".delivery.failure", "Failed delivery attempts");
    this.deliveryExhausted = counter(namePrefix + ".delivery.exhausted", "Delivery tasks out of attempts");
    this.handshakeSuccess = counter(namePrefix + ".handshake.success", "Successful verification handshakes");
    this.handshakeFailure = counter(namePrefix + ".handshake.failure", "Failed verification handshakes");
    this.deliveryDuration = Timer.builder(namePrefix + ".delivery.duration")
        .description("Time per delivery attempt")
        .register(registry);
    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEventsTriggered() {
    if (closed) return;
    eventsTriggered.increment();
  }

  @Override
  public void incrementDeliveryEnqueued() {
    if (closed) return;
    deliveryEnqueued.increment();
  }

  @Override
  public void incrementDeliveryRejected() {
    if (closed) return;
    deliveryRejected.increment();
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementDeliveryExhausted() {
    if (closed) return;
    deliveryExhausted.increment();
  }

  @Override
  public void incrementHandshakeSuccess() {
    if (closed) return;
    handshakeSuccess.increment();
  }

  @Override
  public void incrementHandshakeFailure() {
    if (closed) return;
    handshakeFailure.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordDeliveryDurationMs(long durationMs) {
    if (closed) return;
    deliveryDuration.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(eventsTriggered, deliveryEnqueued, deliveryRejected,
        deliverySuccess, deliveryFailure, deliveryExhausted, handshakeSuccess,
        handshakeFailure, deliveryDuration, queueDepthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
