package io.hookline.spring.boot;

import io.hookline.Hookline;
import io.hookline.dispatch.DeliveryDispatcher;
import io.hookline.intake.EventIntake;
import io.hookline.intake.TriggerReceipt;
import io.hookline.jdbc.DataSourceConnectionProvider;
import io.hookline.jdbc.purge.AbstractJdbcEventPurger;
import io.hookline.jdbc.purge.H2EventPurger;
import io.hookline.jdbc.store.AbstractJdbcSubscriptionStore;
import io.hookline.jdbc.store.H2SubscriptionStore;
import io.hookline.jdbc.store.JdbcEventStore;
import io.hookline.model.Subscription;
import io.hookline.model.SubscriptionStatus;
import io.hookline.model.VerificationMode;
import io.hookline.registry.SubscriptionRegistry;
import io.hookline.spi.ConnectionProvider;
import io.hookline.spi.SubscriptionStore;
import io.hookline.transport.TransportResponse;
import io.hookline.transport.WebhookTransport;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HooklineAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          HooklineAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:hookline_auto_test;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:hookline/schema-h2.sql");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("subscriptionStore"));
      assertTrue(ctx.containsBean("eventStore"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("eventPurger"));
      assertTrue(ctx.containsBean("hookline"));

      assertInstanceOf(H2SubscriptionStore.class, ctx.getBean(AbstractJdbcSubscriptionStore.class));
      assertInstanceOf(JdbcEventStore.class, ctx.getBean(JdbcEventStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(H2EventPurger.class, ctx.getBean(AbstractJdbcEventPurger.class));

      Hookline hookline = ctx.getBean(Hookline.class);
      assertSame(hookline.registry(), ctx.getBean(SubscriptionRegistry.class));
      assertSame(hookline.intake(), ctx.getBean(EventIntake.class));
      assertSame(hookline.dispatcher(), ctx.getBean(DeliveryDispatcher.class));
      assertNotNull(hookline.retentionScheduler());
    });
  }

  @Test
  void appliesProperties() {
    runner
        .withPropertyValues(
            "hookline.failure-ceiling=3",
            "hookline.retry.max-attempts=2")
        .run(ctx -> {
          Hookline hookline = ctx.getBean(Hookline.class);
          assertEquals(3, hookline.registry().failureCeiling());
          assertEquals(2, hookline.dispatcher().maxAttempts());
        });
  }

  @Test
  void retentionCanBeDisabled() {
    runner
        .withPropertyValues("hookline.retention.enabled=false")
        .run(ctx -> {
          assertFalse(ctx.containsBean("eventPurger"));
          assertNull(ctx.getBean(Hookline.class).retentionScheduler());
        });
  }

  @Test
  void customSubscriptionTable() {
    runner
        .withPropertyValues("hookline.subscription-table=custom_subscription")
        .run(ctx -> {
          assertInstanceOf(H2SubscriptionStore.class, ctx.getBean(AbstractJdbcSubscriptionStore.class));
        });
  }

  @Test
  void invalidTableNameFailsStartup() {
    runner
        .withPropertyValues("hookline.subscription-table=bad name;")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void deliversThroughTransportBean() {
    runner
        .withPropertyValues("hookline.allow-private-targets=true")
        .withUserConfiguration(RecordingTransportConfig.class)
        .run(ctx -> {
          Hookline hookline = ctx.getBean(Hookline.class);
          RecordingTransport transport = ctx.getBean(RecordingTransport.class);

          Subscription sub = hookline.registry().create(
              "http://localhost:9999/hooks", List.of("order.created"), VerificationMode.NONE, null);
          assertEquals(SubscriptionStatus.ACTIVE, sub.status());

          TriggerReceipt receipt = hookline.intake().trigger("order.created", "{\"orderId\":\"o1\"}");
          assertEquals(1, receipt.queuedDeliveries());

          long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
          while (hookline.registry().get(sub.id()).deliveryCount() == 0 && System.nanoTime() < deadline) {
            Thread.sleep(20);
          }
          assertEquals(1, hookline.registry().get(sub.id()).deliveryCount());
          assertEquals(1, transport.urls.size());
          assertEquals("http://localhost:9999/hooks", transport.urls.get(0));
        });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(HooklineAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("hookline"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
      assertEquals("myStore", ctx.getBeanNamesForType(SubscriptionStore.class)[0]);
      assertFalse(ctx.containsBean("subscriptionStore"));
    });
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  static class RecordingTransport implements WebhookTransport {
    final List<String> urls = new CopyOnWriteArrayList<>();

    @Override
    public TransportResponse post(String url, Map<String, String> headers, String body) {
      urls.add(url);
      return new TransportResponse(200, "");
    }
  }

  @Configuration
  static class RecordingTransportConfig {
    @Bean
    RecordingTransport recordingTransport() {
      return new RecordingTransport();
    }
  }

  @Configuration
  static class CustomStoreConfig {
    @Bean
    H2SubscriptionStore myStore() {
      return new H2SubscriptionStore("my_subscription");
    }
  }
}
