package io.hookline.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void countsDeliveryLifecycle() {
    exporter.incrementEventsTriggered();
    exporter.incrementDeliveryEnqueued();
    exporter.incrementDeliveryEnqueued();
    exporter.incrementDeliverySuccess();
    exporter.incrementDeliveryFailure();
    exporter.incrementDeliveryExhausted();
    exporter.incrementDeliveryRejected();

    assertEquals(1.0, counter("hookline.events.triggered").count());
    assertEquals(2.0, counter("hookline.delivery.enqueued").count());
    assertEquals(1.0, counter("hookline.delivery.success").count());
    assertEquals(1.0, counter("hookline.delivery.failure").count());
    assertEquals(1.0, counter("hookline.delivery.exhausted").count());
    assertEquals(1.0, counter("hookline.delivery.rejected").count());
  }

  @Test
  void countsHandshakes() {
    exporter.incrementHandshakeSuccess();
    exporter.incrementHandshakeFailure();
    exporter.incrementHandshakeFailure();

    assertEquals(1.0, counter("hookline.handshake.success").count());
    assertEquals(2.0, counter("hookline.handshake.failure").count());
  }

  @Test
  void recordsQueueDepthAndDuration() {
    exporter.recordQueueDepth(17);
    exporter.recordDeliveryDurationMs(120);

    Gauge gauge = registry.find("hookline.queue.depth").gauge();
    assertNotNull(gauge);
    assertEquals(17.0, gauge.value());
    Timer timer = registry.find("hookline.delivery.duration").timer();
    assertNotNull(timer);
    assertEquals(1, timer.count());
    assertEquals(120.0, timer.totalTime(TimeUnit.MILLISECONDS));
  }

  @Test
  void customPrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "billing.hookline");
    custom.incrementDeliverySuccess();
    assertEquals(1.0, counter("billing.hookline.delivery.success").count());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "hookline."));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementDeliverySuccess();

    assertNull(registry.find("hookline.delivery.success").counter());
    assertNull(registry.find("hookline.queue.depth").gauge());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }
}
