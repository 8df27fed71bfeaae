package io.intellixity.strata.driver;

import io.intellixity.strata.compiler.CompiledQuery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Fake driver that records lifecycle calls in order. */
final class RecordingDriver implements Driver {
  final List<String> events = Collections.synchronizedList(new ArrayList<>());
  final AtomicInteger inits = new AtomicInteger();
  final AtomicInteger destroys = new AtomicInteger();
  RuntimeException failCommit;
  RuntimeException failRollback;

  final DatabaseConnection connection = new DatabaseConnection() {
    @Override
    public QueryResult executeQuery(CompiledQuery query) {
      events.add("query:" + query.sql());
      return QueryResult.ofRows(List.of());
    }

    @Override
    public ResultStream streamQuery(CompiledQuery query, int chunkSize) {
      throw new UnsupportedOperationException();
    }
  };

  @Override public void init() {
    inits.incrementAndGet();
    events.add("init");
  }

  @Override public DatabaseConnection acquireConnection() {
    events.add("acquire");
    return connection;
  }

  @Override public void beginTransaction(DatabaseConnection c, TransactionSettings settings) {
    events.add(settings.isolationLevel() == null ? "begin" : "begin:" + settings.isolationLevel().sql());
  }

  @Override public void commitTransaction(DatabaseConnection c) {
    events.add("commit");
    if (failCommit != null) throw failCommit;
  }

  @Override public void rollbackTransaction(DatabaseConnection c) {
    events.add("rollback");
    if (failRollback != null) throw failRollback;
  }

  @Override public void releaseConnection(DatabaseConnection c) {
    events.add("release");
  }

  @Override public void destroy() {
    destroys.incrementAndGet();
    events.add("destroy");
  }
}
