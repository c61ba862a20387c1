package io.hookline.jdbc.store;

import io.hookline.util.JsonCodec;

import java.util.List;

/**
 * H2 subscription store. Primarily for testing and the demo server.
 */
public final class H2SubscriptionStore extends AbstractJdbcSubscriptionStore {

  public H2SubscriptionStore() {
    super();
  }

  public H2SubscriptionStore(String tableName) {
    super(tableName);
  }

  public H2SubscriptionStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcSubscriptionStore withTableName(String tableName) {
    return new H2SubscriptionStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
