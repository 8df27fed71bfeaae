package io.intellixity.strata.postgres;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.intellixity.strata.compiler.CompiledQuery;
import io.intellixity.strata.driver.DatabaseConnection;
import io.intellixity.strata.driver.Driver;
import io.intellixity.strata.driver.IsolationLevel;
import io.intellixity.strata.driver.TransactionSettings;
import io.intellixity.strata.error.DatabaseException;
import io.intellixity.strata.error.DialectConfigurationException;
import io.intellixity.strata.postgres.client.PostgresPool;
import io.intellixity.strata.postgres.client.PostgresPoolClient;
import io.intellixity.strata.postgres.client.PostgresSingleClient;
import io.intellixity.strata.postgres.config.PostgresDialectClientConfig;
import io.intellixity.strata.postgres.config.PostgresDialectConfig;
import io.intellixity.strata.postgres.config.PostgresDialectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Postgres driver over a pool or a single client.
 *
 * Pool mode keeps one {@link PostgresConnection} per pool client, keyed weakly by identity, so
 * the connection-created hook runs once per client rather than once per checkout. The
 * connection holds its client strongly only while checked out; once the pool discards a
 * client, its entry goes away.
 * Single-client mode connects lazily and hands out the same connection to every caller.
 */
public final class PostgresDriver implements Driver {
  private static final Logger log = LoggerFactory.getLogger(PostgresDriver.class);

  private final PostgresDialectConfig config;
  private final Cache<PostgresPoolClient, PostgresConnection> connections =
      CacheBuilder.newBuilder().weakKeys().build();
  private final AtomicReference<PostgresPool> pool = new AtomicReference<>();

  private final Object clientLock = new Object();
  private PostgresSingleClient singleClient;
  private PostgresConnection singleConnection;

  private volatile boolean destroyed;

  public PostgresDriver(PostgresDialectConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  @Override
  public void init() {
    if (destroyed) throw new IllegalStateException("Driver has been destroyed");
    if (config instanceof PostgresDialectPoolConfig pc) {
      pool.compareAndSet(null, pc.pool().get());
      log.debug("strata.pg op=init mode=pool");
    } else {
      log.debug("strata.pg op=init mode=client");
    }
  }

  @Override
  public DatabaseConnection acquireConnection() {
    if (destroyed) throw new IllegalStateException("Driver has been destroyed");
    if (config instanceof PostgresDialectClientConfig cc) {
      return acquireSingle(cc);
    }
    return acquirePooled((PostgresDialectPoolConfig) config);
  }

  private PostgresConnection acquireSingle(PostgresDialectClientConfig cc) {
    synchronized (clientLock) {
      if (destroyed) throw new IllegalStateException("Driver has been destroyed");
      if (singleConnection == null) {
        PostgresSingleClient client = cc.client().get();
        try {
          client.connect();
        } catch (SQLException e) {
          throw new DatabaseException("Failed to connect postgres client", e);
        }
        singleClient = client;
        singleConnection = new PostgresConnection(client, false, cc.cursor());
        log.debug("strata.pg op=connect mode=client");
      }
      return singleConnection;
    }
  }

  private PostgresConnection acquirePooled(PostgresDialectPoolConfig pc) {
    PostgresPool p = pool.get();
    if (p == null) throw new IllegalStateException("Driver is not initialized");
    PostgresPoolClient handle;
    try {
      handle = p.connect();
    } catch (SQLException e) {
      throw new DatabaseException("Failed to acquire pooled connection", e);
    }
    boolean[] created = new boolean[1];
    PostgresConnection connection = connections.asMap().computeIfAbsent(handle, h -> {
      created[0] = true;
      return new PostgresConnection(h, true, pc.cursor());
    });
    if (!created[0]) {
      connection.checkOut(handle);
    } else {
      log.debug("strata.pg op=acquire mode=pool newConnection=true");
      if (pc.onCreateConnection() != null) {
        try {
          pc.onCreateConnection().onCreateConnection(connection);
        } catch (RuntimeException | Error e) {
          connection.release();
          throw e;
        }
      }
    }
    return connection;
  }

  @Override
  public void beginTransaction(DatabaseConnection connection, TransactionSettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (settings.isolationLevel() == IsolationLevel.SNAPSHOT) {
      throw new DialectConfigurationException("Isolation level 'snapshot' is not supported by postgres");
    }
    String sql = (settings.isolationLevel() == null)
        ? "begin"
        : "start transaction isolation level " + settings.isolationLevel().sql();
    connection.executeQuery(CompiledQuery.raw(sql));
  }

  @Override
  public void commitTransaction(DatabaseConnection connection) {
    connection.executeQuery(CompiledQuery.raw("commit"));
  }

  @Override
  public void rollbackTransaction(DatabaseConnection connection) {
    connection.executeQuery(CompiledQuery.raw("rollback"));
  }

  @Override
  public void releaseConnection(DatabaseConnection connection) {
    if (!(connection instanceof PostgresConnection pg)) {
      throw new IllegalArgumentException("Not a postgres connection: " + connection);
    }
    pg.release();
  }

  @Override
  public void destroy() {
    if (config instanceof PostgresDialectClientConfig) {
      PostgresSingleClient client;
      synchronized (clientLock) {
        if (destroyed) return;
        destroyed = true;
        client = singleClient;
        singleClient = null;
        singleConnection = null;
      }
      if (client != null) {
        log.debug("strata.pg op=destroy mode=client");
        shutDown(client::end);
      }
      return;
    }
    destroyed = true;
    PostgresPool p = pool.getAndSet(null);
    if (p == null) return;
    connections.invalidateAll();
    log.debug("strata.pg op=destroy mode=pool");
    shutDown(p::end);
  }

  /** Pooled clients that still have a connection; stale entries are dropped first. */
  long trackedConnections() {
    connections.cleanUp();
    return connections.size();
  }

  private interface SqlAction {
    void run() throws SQLException;
  }

  private static void shutDown(SqlAction end) {
    try {
      end.run();
    } catch (SQLException e) {
      throw new DatabaseException("Failed to shut down postgres client", e);
    }
  }
}
