package io.intellixity.strata.postgres.jdbc;

import io.intellixity.strata.postgres.client.PostgresSingleClient;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

/** Standalone client holding one JDBC connection between {@link #connect()} and {@link #end()}. */
public final class JdbcSingleClient extends JdbcPostgresClient implements PostgresSingleClient {
  private interface ConnectionOpener {
    Connection open() throws SQLException;
  }

  private final ConnectionOpener opener;
  private volatile Connection connection;

  private JdbcSingleClient(ConnectionOpener opener) {
    this.opener = opener;
  }

  public static JdbcSingleClient fromDataSource(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return new JdbcSingleClient(dataSource::getConnection);
  }

  public static JdbcSingleClient fromUrl(String jdbcUrl, Properties properties) {
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    Properties props = (properties == null) ? new Properties() : properties;
    return new JdbcSingleClient(() -> DriverManager.getConnection(jdbcUrl, props));
  }

  @Override
  public synchronized void connect() throws SQLException {
    if (connection == null) connection = opener.open();
  }

  @Override
  public synchronized void end() throws SQLException {
    Connection c = connection;
    connection = null;
    resetTransactionState();
    if (c != null) c.close();
  }

  @Override
  protected Connection connection() throws SQLException {
    Connection c = connection;
    if (c == null) throw new SQLException("Client is not connected", "08003");
    return c;
  }
}
