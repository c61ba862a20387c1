package io.hookline.spring.boot;

import io.hookline.Hookline;
import io.hookline.micrometer.MicrometerMetricsExporter;
import io.hookline.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class HooklineMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(HooklineMicrometerAutoConfiguration.class))
      .withUserConfiguration(SimpleRegistryConfig.class);

  @Test
  void exporterRegisteredWhenMeterRegistryPresent() {
    runner.run(ctx -> {
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
      assertNotNull(ctx.getBean(MeterRegistry.class).find("hookline.events.triggered").counter());
    });
  }

  @Test
  void namePrefixFromProperties() {
    runner.withPropertyValues("hookline.metrics.name-prefix=billing.hooks").run(ctx -> {
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("billing.hooks.queue.depth").gauge());
      assertNull(registry.find("hookline.queue.depth").gauge());
    });
  }

  @Test
  void metricsCanBeSwitchedOff() {
    runner.withPropertyValues("hookline.metrics.enabled=false")
        .run(ctx -> assertTrue(ctx.getBeansOfType(MetricsExporter.class).isEmpty()));
  }

  @Test
  void userExporterWins() {
    runner.withUserConfiguration(NoopExporterConfig.class)
        .run(ctx -> assertSame(MetricsExporter.NOOP, ctx.getBean(MetricsExporter.class)));
  }

  @Test
  void noExporterWithoutMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(HooklineMicrometerAutoConfiguration.class))
        .run(ctx -> assertTrue(ctx.getBeansOfType(MetricsExporter.class).isEmpty()));
  }

  @Test
  void hooklineReportsThroughExporter() {
    runner
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            SqlInitializationAutoConfiguration.class,
            HooklineAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:hookline_metrics_test;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "spring.sql.init.schema-locations=classpath:hookline/schema-h2.sql")
        .run(ctx -> {
          ctx.getBean(Hookline.class).intake().trigger("metrics.check", "{}");
          ctx.getBean(Hookline.class).intake().trigger("metrics.check", "{}");

          MeterRegistry registry = ctx.getBean(MeterRegistry.class);
          assertEquals(2.0, registry.get("hookline.events.triggered").counter().count());
        });
  }

  @Configuration
  static class SimpleRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class NoopExporterConfig {
    @Bean
    MetricsExporter noopMetricsExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
