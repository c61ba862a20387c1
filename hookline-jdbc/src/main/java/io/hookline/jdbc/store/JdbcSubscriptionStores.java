package io.hookline.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC subscription stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.hookline.jdbc.store.AbstractJdbcSubscriptionStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcSubscriptionStore store = JdbcSubscriptionStores.detect(dataSource);
 *
 * // Get by name
 * AbstractJdbcSubscriptionStore store = JdbcSubscriptionStores.get("postgresql");
 * }</pre>
 */
public final class JdbcSubscriptionStores {

  private static final List<AbstractJdbcSubscriptionStore> STORES;
  private static final Map<String, AbstractJdbcSubscriptionStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcSubscriptionStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcSubscriptionStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcSubscriptionStores() {
  }

  public static List<AbstractJdbcSubscriptionStore> all() {
    return STORES;
  }

  /**
   * @param name store name (case-insensitive)
   * @throws IllegalArgumentException if no store has this name
   */
  public static AbstractJdbcSubscriptionStore get(String name) {
    AbstractJdbcSubscriptionStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown subscription store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource's JDBC URL.
   *
   * @throws IllegalStateException if the URL cannot be read
   */
  public static AbstractJdbcSubscriptionStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect subscription store from DataSource", e);
    }
  }

  /**
   * @throws IllegalArgumentException if no registered store handles this URL
   */
  public static AbstractJdbcSubscriptionStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcSubscriptionStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No subscription store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
