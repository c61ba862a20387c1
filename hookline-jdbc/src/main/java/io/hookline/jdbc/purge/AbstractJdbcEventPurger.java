package io.hookline.jdbc.purge;

import io.hookline.jdbc.JdbcTemplate;
import io.hookline.jdbc.TableNames;
import io.hookline.spi.EventPurger;

import java.sql.Connection;
import java.time.Instant;

/**
 * Base JDBC event purger with default subquery-based SQL that works for H2 and
 * PostgreSQL.
 *
 * <p>Subclasses may override {@link #purge} for databases that support more efficient
 * syntax (e.g. MySQL supports {@code DELETE ... ORDER BY ... LIMIT}).
 *
 * @see H2EventPurger
 * @see MySqlEventPurger
 * @see PostgresEventPurger
 */
public abstract class AbstractJdbcEventPurger implements EventPurger {
  private final String tableName;

  protected AbstractJdbcEventPurger() {
    this(TableNames.DEFAULT_EVENT_TABLE);
  }

  protected AbstractJdbcEventPurger(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  protected String tableName() {
    return tableName;
  }

  /**
   * Deletes events created before {@code before}, oldest first, up to {@code limit} rows.
   */
  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE created_at < ?" +
        " ORDER BY created_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(before), limit);
  }

  /**
   * Creates the purger matching a subscription store name ("h2", "mysql", "postgresql").
   *
   * @throws IllegalStateException if no purger exists for the database
   */
  public static AbstractJdbcEventPurger forDatabase(String dbName, String tableName) {
    return switch (dbName) {
      case "h2" -> new H2EventPurger(tableName);
      case "mysql" -> new MySqlEventPurger(tableName);
      case "postgresql" -> new PostgresEventPurger(tableName);
      default -> throw new IllegalStateException("No event purger available for database: " + dbName);
    };
  }
}
