package io.hookline.spring.boot;

import io.hookline.Hookline;
import io.hookline.dispatch.DeliveryDispatcher;
import io.hookline.dispatch.DeliveryObserver;
import io.hookline.dispatch.ExponentialBackoffRetryPolicy;
import io.hookline.intake.EventIntake;
import io.hookline.jdbc.DataSourceConnectionProvider;
import io.hookline.jdbc.TableNames;
import io.hookline.jdbc.purge.AbstractJdbcEventPurger;
import io.hookline.jdbc.store.AbstractJdbcSubscriptionStore;
import io.hookline.jdbc.store.JdbcEventStore;
import io.hookline.jdbc.store.JdbcSubscriptionStores;
import io.hookline.registry.SubscriptionRegistry;
import io.hookline.spi.ConnectionProvider;
import io.hookline.spi.EventPurger;
import io.hookline.spi.EventStore;
import io.hookline.spi.MetricsExporter;
import io.hookline.spi.SubscriptionStore;
import io.hookline.transport.WebhookTransport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for hookline.
 *
 * <p>Wires a {@link Hookline} composite from a {@link DataSource} and
 * {@link HooklineProperties}. The subscription store dialect is detected from the
 * JDBC URL; the event purger follows the detected dialect.
 *
 * @see HooklineProperties
 * @see HooklineMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Hookline.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(HooklineProperties.class)
public class HooklineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(SubscriptionStore.class)
    public AbstractJdbcSubscriptionStore subscriptionStore(DataSource dataSource, HooklineProperties props) {
        AbstractJdbcSubscriptionStore detected = JdbcSubscriptionStores.detect(dataSource);
        String tableName = props.getSubscriptionTable();
        if (!TableNames.DEFAULT_SUBSCRIPTION_TABLE.equals(tableName)) {
            return detected.withTableName(tableName);
        }
        return detected;
    }

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    public JdbcEventStore eventStore(HooklineProperties props) {
        return new JdbcEventStore(props.getEventTable());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(EventPurger.class)
    @ConditionalOnProperty(prefix = "hookline.retention", name = "enabled", matchIfMissing = true)
    public AbstractJdbcEventPurger eventPurger(DataSource dataSource, HooklineProperties props) {
        String dbName = JdbcSubscriptionStores.detect(dataSource).name();
        return AbstractJdbcEventPurger.forDatabase(dbName, props.getEventTable());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Hookline hookline(HooklineProperties props,
                             ConnectionProvider connectionProvider,
                             SubscriptionStore subscriptionStore,
                             EventStore eventStore,
                             ObjectProvider<EventPurger> purgerProvider,
                             ObjectProvider<WebhookTransport> transportProvider,
                             ObjectProvider<MetricsExporter> metricsProvider,
                             ObjectProvider<DeliveryObserver> observerProvider) {
        Hookline.Builder builder = Hookline.builder()
                .connectionProvider(connectionProvider)
                .subscriptionStore(subscriptionStore)
                .eventStore(eventStore)
                .allowPrivateTargets(props.isAllowPrivateTargets())
                .failureCeiling(props.getFailureCeiling())
                .userAgent(props.getUserAgent())
                .workerCount(props.getDispatcher().getWorkerCount())
                .queueCapacity(props.getDispatcher().getQueueCapacity())
                .enqueueTimeoutMs(props.getDispatcher().getEnqueueTimeoutMs())
                .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs())
                .requestTimeout(props.getDispatcher().getRequestTimeout())
                .maxAttempts(props.getRetry().getMaxAttempts())
                .retryPolicy(new ExponentialBackoffRetryPolicy(
                        props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
                .handshakeThreads(props.getVerification().getHandshakeThreads())
                .signatureToleranceSeconds(props.getVerification().getSignatureToleranceSeconds())
                .pendingVerificationTimeout(props.getVerification().getPendingTimeout())
                .eventRetention(props.getRetention().getEventRetention())
                .purgeBatchSize(props.getRetention().getBatchSize())
                .purgeIntervalSeconds(props.getRetention().getIntervalSeconds());

        // A caller-supplied transport bean stays owned by the Spring context.
        WebhookTransport transport = transportProvider.getIfAvailable();
        if (transport != null) {
            builder.transport(transport);
        }
        MetricsExporter metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        EventPurger purger = purgerProvider.getIfAvailable();
        if (purger != null) {
            builder.eventPurger(purger);
        }
        observerProvider.orderedStream().forEach(builder::observer);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionRegistry subscriptionRegistry(Hookline hookline) {
        return hookline.registry();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventIntake eventIntake(Hookline hookline) {
        return hookline.intake();
    }

    // Closed by the Hookline bean.
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public DeliveryDispatcher deliveryDispatcher(Hookline hookline) {
        return hookline.dispatcher();
    }
}
