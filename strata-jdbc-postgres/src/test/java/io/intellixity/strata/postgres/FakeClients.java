package io.intellixity.strata.postgres;

import io.intellixity.strata.postgres.client.NativeQueryResult;
import io.intellixity.strata.postgres.client.PostgresClient;
import io.intellixity.strata.postgres.client.PostgresCursor;
import io.intellixity.strata.postgres.client.PostgresCursorFactory;
import io.intellixity.strata.postgres.client.PostgresPool;
import io.intellixity.strata.postgres.client.PostgresPoolClient;
import io.intellixity.strata.postgres.client.PostgresSingleClient;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Hand-written native clients that record what the driver asks of them. */
final class FakeClients {
  private FakeClients() {}

  static class RecordingClient implements PostgresClient {
    final List<String> statements = Collections.synchronizedList(new ArrayList<>());
    final List<List<Object>> parameters = Collections.synchronizedList(new ArrayList<>());
    NativeQueryResult nextResult = new NativeQueryResult(null, null, List.of());
    SQLException nextFailure;

    @Override
    public NativeQueryResult query(String sql, List<Object> params) throws SQLException {
      statements.add(sql);
      parameters.add(params);
      if (nextFailure != null) {
        SQLException e = nextFailure;
        nextFailure = null;
        throw e;
      }
      return nextResult;
    }
  }

  static final class PoolClient extends RecordingClient implements PostgresPoolClient {
    final AtomicInteger releases = new AtomicInteger();

    @Override public void release() { releases.incrementAndGet(); }
  }

  /** Hands out its clients round-robin, so the same handle comes back on later checkouts. */
  static final class Pool implements PostgresPool {
    final List<PoolClient> clients = new ArrayList<>();
    final AtomicInteger connects = new AtomicInteger();
    final AtomicInteger ends = new AtomicInteger();

    Pool(int size) {
      for (int i = 0; i < size; i++) clients.add(new PoolClient());
    }

    @Override
    public PostgresPoolClient connect() {
      int n = connects.getAndIncrement();
      return clients.get(n % clients.size());
    }

    @Override public void end() { ends.incrementAndGet(); }
  }

  /** Opens a fresh client per checkout and keeps no reference to it, like a pool retiring connections. */
  static final class DisposingPool implements PostgresPool {
    final AtomicInteger connects = new AtomicInteger();

    @Override
    public PostgresPoolClient connect() {
      connects.incrementAndGet();
      return new PoolClient();
    }

    @Override public void end() {}
  }

  static final class SingleClient extends RecordingClient implements PostgresSingleClient {
    final AtomicInteger connects = new AtomicInteger();
    final AtomicInteger ends = new AtomicInteger();

    @Override public void connect() { connects.incrementAndGet(); }
    @Override public void end() { ends.incrementAndGet(); }
  }

  /** Serves {@code totalRows} generated rows; may fail on a given read. */
  static final class Cursor implements PostgresCursor {
    private final int totalRows;
    private int served;
    final List<Integer> reads = new ArrayList<>();
    final AtomicInteger closes = new AtomicInteger();
    int failOnRead = -1;
    SQLException closeFailure;

    Cursor(int totalRows) {
      this.totalRows = totalRows;
    }

    @Override
    public List<Map<String, Object>> read(int maxRows) throws SQLException {
      reads.add(maxRows);
      if (reads.size() == failOnRead) throw new SQLException("read failed", "57014");
      List<Map<String, Object>> out = new ArrayList<>();
      while (out.size() < maxRows && served < totalRows) {
        out.add(Map.of("id", ++served));
      }
      return out;
    }

    @Override
    public void close() throws SQLException {
      closes.incrementAndGet();
      if (closeFailure != null) throw closeFailure;
    }
  }

  static final class CursorFactory implements PostgresCursorFactory {
    final Cursor cursor;
    final AtomicInteger creates = new AtomicInteger();
    PostgresClient lastClient;

    CursorFactory(Cursor cursor) {
      this.cursor = cursor;
    }

    @Override
    public PostgresCursor create(PostgresClient client, String sql, List<Object> parameters) {
      creates.incrementAndGet();
      lastClient = client;
      return cursor;
    }
  }
}
