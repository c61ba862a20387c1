package io.hookline.jdbc;

import io.hookline.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Hands out pooled connections from a {@link DataSource} to the registry, intake,
 * dispatcher and retention scheduler. Callers switch each connection to auto-commit and
 * close it after a single store call, so a pool such as HikariCP sizes the concurrency.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }
}
