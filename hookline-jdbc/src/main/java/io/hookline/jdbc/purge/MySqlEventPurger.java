package io.hookline.jdbc.purge;

import io.hookline.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;

/**
 * MySQL event purger. Also compatible with TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery, so this purger uses
 * {@code DELETE ... ORDER BY ... LIMIT} directly.
 */
public final class MySqlEventPurger extends AbstractJdbcEventPurger {

  public MySqlEventPurger() {
    super();
  }

  public MySqlEventPurger(String tableName) {
    super(tableName);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE created_at < ?" +
        " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(before), limit);
  }
}
