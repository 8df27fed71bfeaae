package io.intellixity.strata.postgres.jdbc;

import io.intellixity.strata.error.DatabaseException;
import io.intellixity.strata.postgres.client.PostgresPoolClient;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Pool client bound to one physical connection.
 *
 * Each checkout attaches the pool's lease (the proxy connection handed out by the pool);
 * {@link #release()} closes the lease, which returns the physical connection to the pool.
 * The same instance is reused on the next checkout of that physical connection.
 */
public final class JdbcPooledClient extends JdbcPostgresClient implements PostgresPoolClient {
  private final Object lock = new Object();
  private Connection lease;

  JdbcPooledClient() {}

  void attach(Connection newLease) {
    synchronized (lock) {
      if (lease != null) throw new IllegalStateException("Pooled client is already checked out");
      lease = newLease;
    }
  }

  boolean checkedOut() {
    synchronized (lock) {
      return lease != null;
    }
  }

  @Override
  protected Connection connection() throws SQLException {
    synchronized (lock) {
      if (lease == null) throw new SQLException("Pooled client has been released", "08003");
      return lease;
    }
  }

  @Override
  public void release() {
    Connection c;
    synchronized (lock) {
      c = lease;
      lease = null;
    }
    if (c == null) return;
    resetTransactionState();
    try {
      c.close();
    } catch (SQLException e) {
      throw new DatabaseException("Failed to return connection to pool", e);
    }
  }
}
