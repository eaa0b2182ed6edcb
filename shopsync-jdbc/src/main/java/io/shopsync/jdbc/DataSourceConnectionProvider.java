package io.shopsync.jdbc;

import io.shopsync.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Hands out connections to the embedded local database from a {@link DataSource}. Every call
 * opens a fresh connection; {@code JdbcTransactionManager} closes it when the local
 * transaction ends, so a pooling data source is the caller's choice.
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
