/**
 * Service Provider Interfaces (SPI) for plugging in persistence, connections and metrics.
 *
 * @see io.hookline.spi.ConnectionProvider
 * @see io.hookline.spi.SubscriptionStore
 * @see io.hookline.spi.EventStore
 * @see io.hookline.spi.MetricsExporter
 */
package io.hookline.spi;
