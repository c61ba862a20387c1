package io.hookline.jdbc.store;

import io.hookline.util.JsonCodec;

import java.util.List;

/**
 * MySQL subscription store. Also compatible with TiDB and MariaDB.
 */
public final class MySqlSubscriptionStore extends AbstractJdbcSubscriptionStore {

  public MySqlSubscriptionStore() {
    super();
  }

  public MySqlSubscriptionStore(String tableName) {
    super(tableName);
  }

  public MySqlSubscriptionStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcSubscriptionStore withTableName(String tableName) {
    return new MySqlSubscriptionStore(tableName, jsonCodec());
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }
}
