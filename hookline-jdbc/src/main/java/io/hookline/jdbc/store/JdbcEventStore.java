package io.hookline.jdbc.store;

import io.hookline.jdbc.JdbcTemplate;
import io.hookline.jdbc.TableNames;
import io.hookline.model.EventEnvelope;
import io.hookline.spi.EventStore;

import java.sql.Connection;
import java.util.Optional;

/**
 * JDBC event store. The SQL is portable across H2, PostgreSQL and MySQL.
 *
 * <p>Events are written once at intake and only read back for manual retries; the
 * retention purger deletes them.
 */
public final class JdbcEventStore implements EventStore {
  private static final JdbcTemplate.RowMapper<EventEnvelope> EVENT_ROW_MAPPER = rs -> new EventEnvelope(
      rs.getString("id"),
      rs.getString("event_type"),
      rs.getString("payload"),
      rs.getTimestamp("created_at").toInstant());

  private final String tableName;

  public JdbcEventStore() {
    this(TableNames.DEFAULT_EVENT_TABLE);
  }

  public JdbcEventStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  @Override
  public void insert(Connection conn, EventEnvelope event) {
    String sql = "INSERT INTO " + tableName + " (id, event_type, payload, created_at) VALUES (?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        event.id(), event.type(), event.payloadJson(), JdbcTemplate.timestamp(event.createdAt()));
  }

  @Override
  public Optional<EventEnvelope> find(Connection conn, String eventId) {
    String sql = "SELECT id, event_type, payload, created_at FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, EVENT_ROW_MAPPER, eventId);
  }
}
