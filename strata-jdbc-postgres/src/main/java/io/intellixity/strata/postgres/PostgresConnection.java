package io.intellixity.strata.postgres;

import io.intellixity.strata.compiler.CompiledQuery;
import io.intellixity.strata.driver.DatabaseConnection;
import io.intellixity.strata.driver.QueryResult;
import io.intellixity.strata.driver.ResultStream;
import io.intellixity.strata.error.DatabaseException;
import io.intellixity.strata.error.DialectConfigurationException;
import io.intellixity.strata.postgres.client.NativeQueryResult;
import io.intellixity.strata.postgres.client.PostgresClient;
import io.intellixity.strata.postgres.client.PostgresCursor;
import io.intellixity.strata.postgres.client.PostgresCursorFactory;
import io.intellixity.strata.postgres.client.PostgresPoolClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * One native client handle, wrapped. Created by {@link PostgresDriver}.
 *
 * A pooled connection references its handle strongly only between checkout and
 * {@link #release()}, so the driver's handle-to-connection cache never keeps a handle alive
 * after the pool lets go of it.
 */
final class PostgresConnection implements DatabaseConnection {
  private static final Logger log = LoggerFactory.getLogger(PostgresConnection.class);

  private static final Set<String> MUTATING_COMMANDS = Set.of("INSERT", "UPDATE", "DELETE", "MERGE");

  private final WeakReference<PostgresClient> handle;
  private final boolean pooled;
  private final PostgresCursorFactory cursorFactory;
  private volatile PostgresClient checkedOut;

  PostgresConnection(PostgresClient client, boolean pooled, PostgresCursorFactory cursorFactory) {
    this.handle = new WeakReference<>(client);
    this.pooled = pooled;
    this.cursorFactory = cursorFactory;
    this.checkedOut = client;
  }

  /** Pins the handle again for a later checkout of the same pooled client. */
  void checkOut(PostgresClient client) {
    checkedOut = client;
  }

  PostgresClient client() {
    PostgresClient c = checkedOut;
    if (c == null) c = handle.get();
    if (c == null) throw new IllegalStateException("Pooled client was discarded by its pool");
    return c;
  }

  @Override
  public QueryResult executeQuery(CompiledQuery query) {
    logStatement("executeQuery", query);
    long start = System.nanoTime();
    NativeQueryResult result;
    try {
      result = client().query(query.sql(), query.parameters());
    } catch (SQLException e) {
      throw new DatabaseException("Query failed", e);
    }
    Long affected = null;
    if (result.command() != null && MUTATING_COMMANDS.contains(result.command())) {
      affected = (result.rowCount() == null) ? 0L : result.rowCount();
    }
    if (log.isDebugEnabled()) {
      log.debug("strata.pg_done op=executeQuery command={} durationMs={} rows={} affected={}",
          result.command(), (System.nanoTime() - start) / 1_000_000.0, result.rows().size(), affected);
    }
    return new QueryResult(result.rows(), affected);
  }

  @Override
  public ResultStream streamQuery(CompiledQuery query, int chunkSize) {
    if (cursorFactory == null) {
      throw new DialectConfigurationException(
          "'cursor' is not present in your postgres dialect config. It's required to make streaming work in postgres.");
    }
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be a positive integer");
    }
    logStatement("streamQuery", query);
    PostgresCursor cursor;
    try {
      cursor = cursorFactory.create(client(), query.sql(), query.parameters());
    } catch (SQLException e) {
      throw new DatabaseException("Failed to open cursor", e);
    }
    return new CursorResultStream(cursor, chunkSize);
  }

  /** Returns a pooled handle to its pool; a standalone client stays open. */
  void release() {
    if (!pooled) return;
    PostgresClient c = checkedOut;
    checkedOut = null;
    if (c == null) c = handle.get();
    if (c != null) ((PostgresPoolClient) c).release();
  }

  private static void logStatement(String op, CompiledQuery query) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.pg op={} paramCount={} sql={}", op, query.parameters().size(), query.sql());
    if (log.isTraceEnabled()) {
      List<Object> params = query.parameters();
      for (int i = 0; i < params.size(); i++) {
        Object v = params.get(i);
        log.trace("strata.pg param index={} valueType={} valueLen={}",
            i + 1, v == null ? "null" : v.getClass().getSimpleName(), v == null ? 0 : String.valueOf(v).length());
      }
    }
  }

  /** Reads one batch per {@code next()}; closes the cursor exactly once. */
  static final class CursorResultStream implements ResultStream {
    private final PostgresCursor cursor;
    private final int chunkSize;
    private final long startNanos = System.nanoTime();
    private int batches;
    private long rowCount;
    private List<Map<String, Object>> pending;
    private boolean exhausted;
    private boolean closed;

    CursorResultStream(PostgresCursor cursor, int chunkSize) {
      this.cursor = cursor;
      this.chunkSize = chunkSize;
    }

    @Override
    public boolean hasNext() {
      if (pending != null) return true;
      if (exhausted || closed) return false;
      List<Map<String, Object>> rows;
      try {
        rows = cursor.read(chunkSize);
      } catch (SQLException e) {
        DatabaseException failure = new DatabaseException("Cursor read failed", e);
        closeAfterFailure(failure);
        throw failure;
      } catch (RuntimeException e) {
        closeAfterFailure(e);
        throw e;
      }
      if (rows == null || rows.isEmpty()) {
        exhausted = true;
        close();
        return false;
      }
      batches++;
      rowCount += rows.size();
      pending = rows;
      return true;
    }

    @Override
    public QueryResult next() {
      if (!hasNext()) throw new NoSuchElementException();
      List<Map<String, Object>> rows = pending;
      pending = null;
      return QueryResult.ofRows(rows);
    }

    @Override
    public void close() {
      if (closed) return;
      closed = true;
      pending = null;
      try {
        cursor.close();
      } catch (SQLException e) {
        throw new DatabaseException("Failed to close cursor", e);
      } finally {
        if (log.isDebugEnabled()) {
          log.debug("strata.pg_done op=streamQuery durationMs={} batches={} rows={} exhausted={}",
              (System.nanoTime() - startNanos) / 1_000_000.0, batches, rowCount, exhausted);
        }
      }
    }

    private void closeAfterFailure(RuntimeException primary) {
      try {
        close();
      } catch (RuntimeException closeFailure) {
        primary.addSuppressed(closeFailure);
      }
    }
  }
}
