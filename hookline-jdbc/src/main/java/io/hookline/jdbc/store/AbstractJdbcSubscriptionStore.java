package io.hookline.jdbc.store;

import io.hookline.jdbc.JdbcTemplate;
import io.hookline.jdbc.TableNames;
import io.hookline.model.DeliveryStatus;
import io.hookline.model.Subscription;
import io.hookline.model.SubscriptionStatus;
import io.hookline.model.VerificationMode;
import io.hookline.spi.SubscriptionStore;
import io.hookline.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC subscription store with standard SQL implementations.
 *
 * <p>{@code events} and {@code metadata} are stored as JSON text. Writes are guarded by
 * the {@code version} column: {@link #update} only touches a row still carrying the
 * expected version.
 *
 * <p>Register custom implementations via
 * {@code META-INF/services/io.hookline.jdbc.store.AbstractJdbcSubscriptionStore}.
 *
 * @see JdbcSubscriptionStores
 */
public abstract class AbstractJdbcSubscriptionStore implements SubscriptionStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS =
      "id, url, events, verification_mode, signing_secret, verification_token, status, " +
      "delivery_count, consecutive_failures, last_delivery_at, last_delivery_status, " +
      "last_delivery_error, last_failed_event_id, verified_at, last_handshake_error, " +
      "metadata, created_at, updated_at, version";

  private final String tableName;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcSubscriptionStore() {
    this(TableNames.DEFAULT_SUBSCRIPTION_TABLE);
  }

  protected AbstractJdbcSubscriptionStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcSubscriptionStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /** Returns a store of the same database flavour bound to another table. */
  public abstract AbstractJdbcSubscriptionStore withTableName(String tableName);

  protected String tableName() {
    return tableName;
  }

  @Override
  public void insert(Connection conn, Subscription s) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") " +
        "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        s.id(), s.url(), jsonCodec.toJson(s.events()), s.verificationMode().code(),
        s.signingSecret(), s.verificationToken(), s.status().code(),
        s.deliveryCount(), s.consecutiveFailures(), JdbcTemplate.timestamp(s.lastDeliveryAt()),
        s.lastDeliveryStatus() == null ? null : s.lastDeliveryStatus().code(),
        truncateError(s.lastDeliveryError()), s.lastFailedEventId(),
        JdbcTemplate.timestamp(s.verifiedAt()), truncateError(s.lastHandshakeError()),
        jsonCodec.toJson(s.metadata()), JdbcTemplate.timestamp(s.createdAt()),
        JdbcTemplate.timestamp(s.updatedAt()), s.version());
  }

  @Override
  public Optional<Subscription> find(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return JdbcTemplate.queryOne(conn, sql, this::mapRow, id);
  }

  @Override
  public List<Subscription> findAll(Connection conn, SubscriptionStatus status) {
    if (status == null) {
      String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " ORDER BY created_at, id";
      return JdbcTemplate.query(conn, sql, this::mapRow);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status=? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, this::mapRow, status.code());
  }

  @Override
  public List<Subscription> findCreatedBefore(Connection conn, SubscriptionStatus status, Instant before) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status=? AND created_at < ? ORDER BY created_at, id";
    return JdbcTemplate.query(conn, sql, this::mapRow, status.code(), JdbcTemplate.timestamp(before));
  }

  @Override
  public int update(Connection conn, Subscription s, long expectedVersion) {
    String sql = "UPDATE " + tableName() + " SET url=?, events=?, verification_mode=?, " +
        "signing_secret=?, verification_token=?, status=?, delivery_count=?, " +
        "consecutive_failures=?, last_delivery_at=?, last_delivery_status=?, " +
        "last_delivery_error=?, last_failed_event_id=?, verified_at=?, " +
        "last_handshake_error=?, metadata=?, updated_at=?, version=? " +
        "WHERE id=? AND version=?";
    return JdbcTemplate.update(conn, sql,
        s.url(), jsonCodec.toJson(s.events()), s.verificationMode().code(),
        s.signingSecret(), s.verificationToken(), s.status().code(), s.deliveryCount(),
        s.consecutiveFailures(), JdbcTemplate.timestamp(s.lastDeliveryAt()),
        s.lastDeliveryStatus() == null ? null : s.lastDeliveryStatus().code(),
        truncateError(s.lastDeliveryError()), s.lastFailedEventId(),
        JdbcTemplate.timestamp(s.verifiedAt()), truncateError(s.lastHandshakeError()),
        jsonCodec.toJson(s.metadata()), JdbcTemplate.timestamp(s.updatedAt()), s.version(),
        s.id(), expectedVersion);
  }

  @Override
  public int delete(Connection conn, String id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE id=?", id);
  }

  protected Subscription mapRow(ResultSet rs) throws SQLException {
    String deliveryStatus = rs.getString("last_delivery_status");
    return Subscription.builder()
        .id(rs.getString("id"))
        .url(rs.getString("url"))
        .events(jsonCodec.parseStringList(rs.getString("events")))
        .verificationMode(VerificationMode.fromCode(rs.getString("verification_mode")))
        .signingSecret(rs.getString("signing_secret"))
        .verificationToken(rs.getString("verification_token"))
        .status(SubscriptionStatus.fromCode(rs.getString("status")))
        .deliveryCount(rs.getLong("delivery_count"))
        .consecutiveFailures(rs.getInt("consecutive_failures"))
        .lastDeliveryAt(JdbcTemplate.instant(rs, "last_delivery_at"))
        .lastDeliveryStatus(deliveryStatus == null ? null : DeliveryStatus.fromCode(deliveryStatus))
        .lastDeliveryError(rs.getString("last_delivery_error"))
        .lastFailedEventId(rs.getString("last_failed_event_id"))
        .verifiedAt(JdbcTemplate.instant(rs, "verified_at"))
        .lastHandshakeError(rs.getString("last_handshake_error"))
        .metadata(jsonCodec.parseObject(rs.getString("metadata")))
        .createdAt(JdbcTemplate.instant(rs, "created_at"))
        .updatedAt(JdbcTemplate.instant(rs, "updated_at"))
        .version(rs.getLong("version"))
        .build();
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  private static String truncateError(String error) {
    if (error == null) {
      return null;
    }
    return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
  }
}
