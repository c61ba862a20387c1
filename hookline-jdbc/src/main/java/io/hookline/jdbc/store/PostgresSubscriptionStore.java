package io.hookline.jdbc.store;

import io.hookline.util.JsonCodec;

import java.util.List;

/**
 * PostgreSQL subscription store.
 *
 * <p>Uses the standard SQL from {@link AbstractJdbcSubscriptionStore}; {@code events} and
 * {@code metadata} are plain {@code TEXT} columns.
 */
public final class PostgresSubscriptionStore extends AbstractJdbcSubscriptionStore {

  public PostgresSubscriptionStore() {
    super();
  }

  public PostgresSubscriptionStore(String tableName) {
    super(tableName);
  }

  public PostgresSubscriptionStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcSubscriptionStore withTableName(String tableName) {
    return new PostgresSubscriptionStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }
}
