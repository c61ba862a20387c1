/**
 * JDBC-backed {@link io.hookline.spi.SubscriptionStore} and {@link io.hookline.spi.EventStore}.
 *
 * <p>{@link io.hookline.jdbc.store.AbstractJdbcSubscriptionStore} holds the shared SQL and
 * row mapping. Database flavours are discovered by JDBC URL through
 * {@link io.hookline.jdbc.store.JdbcSubscriptionStores}.
 */
package io.hookline.jdbc.store;
