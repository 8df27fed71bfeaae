package io.intellixity.strata.postgres.jdbc;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.intellixity.strata.postgres.client.PostgresPool;
import io.intellixity.strata.postgres.client.PostgresPoolClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link PostgresPool} over a pooling {@link DataSource} such as HikariCP.
 *
 * Keeps one {@link JdbcPooledClient} per physical connection (found through
 * {@code Connection.unwrap(Connection.class)}), so a pool slot keeps the same client identity
 * across checkouts. Clients are keyed weakly, so an entry goes away once the pool retires its
 * physical connection.
 */
public final class DataSourcePostgresPool implements PostgresPool {
  private static final Logger log = LoggerFactory.getLogger(DataSourcePostgresPool.class);

  private final DataSource dataSource;
  private final Cache<Connection, JdbcPooledClient> clients = CacheBuilder.newBuilder().weakKeys().build();

  public DataSourcePostgresPool(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public PostgresPoolClient connect() throws SQLException {
    Connection lease = dataSource.getConnection();
    try {
      Connection physical = lease.unwrap(Connection.class);
      boolean[] created = new boolean[1];
      JdbcPooledClient client = clients.asMap().computeIfAbsent(physical == null ? lease : physical, k -> {
        created[0] = true;
        return new JdbcPooledClient();
      });
      if (created[0] && log.isDebugEnabled()) {
        log.debug("strata.jdbc op=connect newPhysicalConnection=true tracked={}", clients.size());
      }
      client.attach(lease);
      return client;
    } catch (SQLException | RuntimeException e) {
      try {
        lease.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  /** Physical connections that still have a client; stale entries are dropped first. */
  long trackedClients() {
    clients.cleanUp();
    return clients.size();
  }

  @Override
  public void end() throws SQLException {
    clients.invalidateAll();
    if (dataSource instanceof AutoCloseable closeable) {
      log.debug("strata.jdbc op=end dataSource={}", dataSource.getClass().getSimpleName());
      try {
        closeable.close();
      } catch (SQLException | RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new SQLException("Failed to close data source", e);
      }
    }
  }
}
