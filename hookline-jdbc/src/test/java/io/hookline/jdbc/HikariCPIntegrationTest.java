package io.hookline.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.hookline.Hookline;
import io.hookline.intake.TriggerReceipt;
import io.hookline.jdbc.purge.H2EventPurger;
import io.hookline.jdbc.store.H2SubscriptionStore;
import io.hookline.jdbc.store.JdbcEventStore;
import io.hookline.model.Subscription;
import io.hookline.model.VerificationMode;
import io.hookline.transport.TransportResponse;
import io.hookline.transport.WebhookTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private Hookline hookline;
  private final List<String> delivered = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setup() throws SQLException {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("hookline-test-pool");
    hikariDs = new HikariDataSource(config);
    try (Connection conn = hikariDs.getConnection()) {
      SchemaScripts.apply(conn, "h2");
    }

    WebhookTransport transport = (url, headers, body) -> {
      delivered.add(headers.get("X-Event-Id"));
      return new TransportResponse(200, "");
    };
    hookline = Hookline.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .subscriptionStore(new H2SubscriptionStore())
        .eventStore(new JdbcEventStore())
        .eventPurger(new H2EventPurger())
        .eventRetention(Duration.ofDays(1))
        .transport(transport)
        .workerCount(2)
        .build();
  }

  @AfterEach
  void tearDown() {
    if (hookline != null) {
      hookline.close();
    }
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void triggerAndDeliverThroughPool() throws Exception {
    Subscription sub = hookline.registry().create("https://hooks.example.com/in",
        List.of("order.created"), VerificationMode.NONE, Map.of());

    TriggerReceipt first = hookline.intake().trigger("order.created", "{\"orderId\":\"o1\"}");
    TriggerReceipt second = hookline.intake().trigger("order.created", "{\"orderId\":\"o2\"}");

    long deadline = System.currentTimeMillis() + 5000;
    while (hookline.dispatcher().stats(sub.id()).deliveryCount() < 2 && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }
    assertEquals(2, hookline.dispatcher().stats(sub.id()).deliveryCount());
    assertTrue(delivered.containsAll(List.of(first.event().id(), second.event().id())));
    assertEquals("{\"orderId\":\"o1\"}", hookline.intake().get(first.event().id()).payloadJson());
  }

  @Test
  void retentionPurgesOldEvents() throws Exception {
    try (Connection conn = hikariDs.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "INSERT INTO webhook_event (id, event_type, payload, created_at) VALUES (?,?,?,?)")) {
      ps.setString(1, "evt_old");
      ps.setString(2, "order.created");
      ps.setString(3, "{}");
      ps.setTimestamp(4, java.sql.Timestamp.from(Instant.now().minus(Duration.ofDays(3))));
      ps.executeUpdate();
    }
    String fresh = hookline.intake().trigger("order.created", "{}").event().id();

    assertEquals(1, hookline.retentionScheduler().runOnce());

    assertTrue(hookline.intake().find("evt_old").isEmpty());
    assertTrue(hookline.intake().find(fresh).isPresent());
    assertEquals(1, countEvents());
  }

  private int countEvents() throws SQLException {
    try (Connection conn = hikariDs.getConnection();
         PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM webhook_event");
         ResultSet rs = ps.executeQuery()) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
