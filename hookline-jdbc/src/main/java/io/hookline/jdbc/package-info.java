/**
 * JDBC plumbing shared by the hookline stores.
 *
 * @see io.hookline.jdbc.store.JdbcSubscriptionStores
 * @see io.hookline.jdbc.purge.AbstractJdbcEventPurger
 */
package io.hookline.jdbc;
