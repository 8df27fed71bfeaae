package io.intellixity.strata.postgres;

import io.intellixity.strata.compiler.CompiledQuery;
import io.intellixity.strata.driver.DatabaseConnection;
import io.intellixity.strata.driver.IsolationLevel;
import io.intellixity.strata.driver.QueryResult;
import io.intellixity.strata.driver.ResultStream;
import io.intellixity.strata.driver.RuntimeDriver;
import io.intellixity.strata.driver.TransactionSettings;
import io.intellixity.strata.error.DatabaseException;
import io.intellixity.strata.error.DialectConfigurationException;
import io.intellixity.strata.postgres.client.NativeQueryResult;
import io.intellixity.strata.postgres.client.PostgresClient;
import io.intellixity.strata.postgres.config.PostgresDialectClientConfig;
import io.intellixity.strata.postgres.config.PostgresDialectPoolConfig;
import org.junit.jupiter.api.Test;

import java.lang.ref.WeakReference;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDriverTest {
  private static final CompiledQuery SELECT = CompiledQuery.raw("select id from person where id > $1", List.of(0));

  private static PostgresDriver poolDriver(FakeClients.Pool pool) {
    PostgresDriver driver = new PostgresDriver(PostgresDialectPoolConfig.of(pool));
    driver.init();
    return driver;
  }

  @Test
  void singleClientIsResolvedConnectedAndSharedOnce() {
    FakeClients.SingleClient client = new FakeClients.SingleClient();
    AtomicInteger factoryCalls = new AtomicInteger();
    PostgresDriver driver = new PostgresDriver(PostgresDialectClientConfig.lazy(() -> {
      factoryCalls.incrementAndGet();
      return client;
    }));
    driver.init();

    DatabaseConnection first = driver.acquireConnection();
    driver.releaseConnection(first);
    DatabaseConnection second = driver.acquireConnection();

    assertSame(first, second);
    assertEquals(1, factoryCalls.get());
    assertEquals(1, client.connects.get());
    assertEquals(0, client.ends.get());
  }

  @Test
  void poolFactoryRunsOnceForRepeatedInit() {
    AtomicInteger factoryCalls = new AtomicInteger();
    FakeClients.Pool pool = new FakeClients.Pool(1);
    PostgresDriver driver = new PostgresDriver(PostgresDialectPoolConfig.lazy(() -> {
      factoryCalls.incrementAndGet();
      return pool;
    }));

    driver.init();
    driver.init();

    assertEquals(1, factoryCalls.get());
  }

  @Test
  void connectionHookRunsOncePerPooledHandle() {
    FakeClients.Pool pool = new FakeClients.Pool(2);
    List<DatabaseConnection> hooked = new ArrayList<>();
    PostgresDriver driver = new PostgresDriver(PostgresDialectPoolConfig.of(pool).withOnCreateConnection(hooked::add));
    driver.init();

    List<DatabaseConnection> acquired = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      DatabaseConnection c = driver.acquireConnection();
      acquired.add(c);
      driver.releaseConnection(c);
    }

    assertEquals(2, hooked.size());
    assertSame(acquired.get(0), acquired.get(2));
    assertSame(acquired.get(1), acquired.get(3));
    assertNotSame(acquired.get(0), acquired.get(1));
    assertEquals(2, pool.clients.get(0).releases.get());
  }

  @Test
  void failingHookReleasesHandleAndPropagates() {
    FakeClients.Pool pool = new FakeClients.Pool(1);
    PostgresDriver driver = new PostgresDriver(PostgresDialectPoolConfig.of(pool)
        .withOnCreateConnection(c -> { throw new IllegalStateException("set search_path failed"); }));
    driver.init();

    assertThrows(IllegalStateException.class, driver::acquireConnection);
    assertEquals(1, pool.clients.get(0).releases.get());
  }

  @Test
  void destroyEndsPoolOnceAndRefusesLaterAcquire() {
    FakeClients.Pool pool = new FakeClients.Pool(1);
    PostgresDriver driver = poolDriver(pool);

    driver.destroy();
    driver.destroy();

    assertEquals(1, pool.ends.get());
    assertThrows(IllegalStateException.class, driver::acquireConnection);
  }

  @Test
  void destroyEndsSingleClientOnce() {
    FakeClients.SingleClient client = new FakeClients.SingleClient();
    PostgresDriver driver = new PostgresDriver(PostgresDialectClientConfig.of(client));
    driver.init();
    driver.acquireConnection();

    driver.destroy();
    driver.destroy();

    assertEquals(1, client.ends.get());
    assertThrows(IllegalStateException.class, driver::acquireConnection);
  }

  @Test
  void acquireBeforeInitFailsInPoolMode() {
    PostgresDriver driver = new PostgresDriver(PostgresDialectPoolConfig.of(new FakeClients.Pool(1)));
    assertThrows(IllegalStateException.class, driver::acquireConnection);
  }

  @Test
  void transactionStatementsAreIssuedAsSql() {
    FakeClients.Pool pool = new FakeClients.Pool(1);
    PostgresDriver driver = poolDriver(pool);
    DatabaseConnection c = driver.acquireConnection();

    driver.beginTransaction(c, TransactionSettings.of(IsolationLevel.SERIALIZABLE));
    driver.commitTransaction(c);
    driver.beginTransaction(c, TransactionSettings.none());
    driver.rollbackTransaction(c);

    assertEquals(List.of("start transaction isolation level serializable", "commit", "begin", "rollback"),
        pool.clients.get(0).statements);
  }

  @Test
  void mutatingCommandsReportAffectedRows() {
    FakeClients.Pool pool = new FakeClients.Pool(1);
    PostgresDriver driver = poolDriver(pool);
    DatabaseConnection c = driver.acquireConnection();

    pool.clients.get(0).nextResult = new NativeQueryResult("UPDATE", 3L, List.of());
    QueryResult update = c.executeQuery(CompiledQuery.raw("update person set age = age + 1"));
    assertEquals(3L, update.numAffectedRows());
    assertTrue(update.rows().isEmpty());

    pool.clients.get(0).nextResult = new NativeQueryResult("SELECT", 1L, List.of(Map.of("id", 1)));
    QueryResult select = c.executeQuery(SELECT);
    assertNull(select.numAffectedRows());
    assertEquals(List.of(Map.of("id", 1)), select.rows());
    assertEquals(List.of(0), pool.clients.get(0).parameters.get(1));
  }

  @Test
  void clientFailureIsWrappedWithSqlState() {
    FakeClients.Pool pool = new FakeClients.Pool(1);
    PostgresDriver driver = poolDriver(pool);
    DatabaseConnection c = driver.acquireConnection();
    SQLException cause = new SQLException("duplicate key value", "23505");
    pool.clients.get(0).nextFailure = cause;

    DatabaseException ex = assertThrows(DatabaseException.class, () -> c.executeQuery(SELECT));
    assertSame(cause, ex.getCause());
    assertEquals("23505", ex.sqlState());
  }

  @Test
  void streamsInChunksAndClosesCursorOnExhaustion() {
    FakeClients.Cursor cursor = new FakeClients.Cursor(5);
    FakeClients.CursorFactory cursors = new FakeClients.CursorFactory(cursor);
    FakeClients.Pool pool = new FakeClients.Pool(1);
    PostgresDriver driver = new PostgresDriver(PostgresDialectPoolConfig.of(pool).withCursor(cursors));
    driver.init();
    DatabaseConnection c = driver.acquireConnection();

    List<Integer> sizes = new ArrayList<>();
    try (ResultStream stream = c.streamQuery(SELECT, 2)) {
      while (stream.hasNext()) sizes.add(stream.next().rows().size());
    }

    assertEquals(List.of(2, 2, 1), sizes);
    assertEquals(1, cursor.closes.get());
    assertSame(pool.clients.get(0), cursors.lastClient);
  }

  @Test
  void earlyCloseClosesCursorOnce() {
    FakeClients.Cursor cursor = new FakeClients.Cursor(10);
    PostgresConnection c = new PostgresConnection(new FakeClients.RecordingClient(), false,
        new FakeClients.CursorFactory(cursor));

    ResultStream stream = c.streamQuery(SELECT, 3);
    assertEquals(3, stream.next().rows().size());
    stream.close();
    stream.close();

    assertEquals(1, cursor.closes.get());
    assertFalse(stream.hasNext());
  }

  @Test
  void readFailureClosesCursorAndKeepsOriginalError() {
    FakeClients.Cursor cursor = new FakeClients.Cursor(10);
    cursor.failOnRead = 2;
    cursor.closeFailure = new SQLException("close failed");
    PostgresConnection c = new PostgresConnection(new FakeClients.RecordingClient(), false,
        new FakeClients.CursorFactory(cursor));

    ResultStream stream = c.streamQuery(SELECT, 4);
    assertEquals(4, stream.next().rows().size());
    DatabaseException ex = assertThrows(DatabaseException.class, stream::next);

    assertEquals("57014", ex.sqlState());
    assertEquals(1, ex.getSuppressed().length);
    assertEquals(1, cursor.closes.get());
    stream.close();
    assertEquals(1, cursor.closes.get());
  }

  @Test
  void streamAdapterClosesCursor() {
    FakeClients.Cursor cursor = new FakeClients.Cursor(3);
    PostgresConnection c = new PostgresConnection(new FakeClients.RecordingClient(), false,
        new FakeClients.CursorFactory(cursor));

    long total;
    try (var batches = c.streamQuery(SELECT, 10).stream()) {
      total = batches.mapToLong(b -> b.rows().size()).sum();
    }

    assertEquals(3, total);
    assertEquals(1, cursor.closes.get());
  }

  @Test
  void streamingPreconditionsFailBeforeAnyNativeCall() {
    FakeClients.RecordingClient client = new FakeClients.RecordingClient();
    PostgresConnection noCursor = new PostgresConnection(client, false, null);
    DialectConfigurationException ex =
        assertThrows(DialectConfigurationException.class, () -> noCursor.streamQuery(SELECT, 10));
    assertTrue(ex.getMessage().startsWith("'cursor' is not present in your postgres dialect config"));

    FakeClients.CursorFactory cursors = new FakeClients.CursorFactory(new FakeClients.Cursor(1));
    PostgresConnection withCursor = new PostgresConnection(client, false, cursors);
    IllegalArgumentException bad = assertThrows(IllegalArgumentException.class, () -> withCursor.streamQuery(SELECT, 0));
    assertEquals("chunkSize must be a positive integer", bad.getMessage());
    IllegalArgumentException negative = assertThrows(IllegalArgumentException.class, () -> withCursor.streamQuery(SELECT, -3));
    assertEquals("chunkSize must be a positive integer", negative.getMessage());

    assertEquals(0, cursors.creates.get());
    assertTrue(client.statements.isEmpty());
  }

  @Test
  void releasingStandaloneConnectionKeepsClientOpen() {
    FakeClients.SingleClient client = new FakeClients.SingleClient();
    PostgresDriver driver = new PostgresDriver(PostgresDialectClientConfig.of(client));
    driver.init();

    driver.releaseConnection(driver.acquireConnection());

    assertEquals(0, client.ends.get());
  }

  @Test
  void runtimeDriverKeepsSingleClientConnectionIdentity() {
    RuntimeDriver driver = new RuntimeDriver(new PostgresDriver(
        PostgresDialectClientConfig.of(new FakeClients.SingleClient())));

    DatabaseConnection first = driver.acquireConnection();
    driver.releaseConnection(first);
    DatabaseConnection second = driver.acquireConnection();

    assertSame(first, second);
    assertInstanceOf(PostgresConnection.class, first);
  }

  @Test
  void runtimeDriverPassesTheSameConnectionToHookAndCaller() {
    FakeClients.Pool pool = new FakeClients.Pool(1);
    List<DatabaseConnection> hooked = new ArrayList<>();
    RuntimeDriver driver = new RuntimeDriver(new PostgresDriver(
        PostgresDialectPoolConfig.of(pool).withOnCreateConnection(hooked::add)));

    DatabaseConnection c = driver.acquireConnection();

    assertEquals(List.of(c), hooked);
  }

  @Test
  void snapshotIsolationIsRejected() {
    FakeClients.Pool pool = new FakeClients.Pool(1);
    PostgresDriver driver = poolDriver(pool);
    DatabaseConnection c = driver.acquireConnection();

    assertThrows(DialectConfigurationException.class,
        () -> driver.beginTransaction(c, TransactionSettings.of(IsolationLevel.SNAPSHOT)));
    assertTrue(pool.clients.get(0).statements.isEmpty());
  }

  @Test
  void releasedConnectionDoesNotKeepDiscardedHandleAlive() throws Exception {
    FakeClients.DisposingPool pool = new FakeClients.DisposingPool();
    PostgresDriver driver = new PostgresDriver(PostgresDialectPoolConfig.of(pool));
    driver.init();

    WeakReference<PostgresClient> handle = checkOutAndRelease(driver);
    for (int i = 0; i < 50 && handle.get() != null; i++) {
      System.gc();
      Thread.sleep(20);
    }

    assertNull(handle.get());
    assertEquals(0L, driver.trackedConnections());
  }

  @Test
  void checkedOutConnectionKeepsItsHandle() throws Exception {
    FakeClients.DisposingPool pool = new FakeClients.DisposingPool();
    PostgresDriver driver = new PostgresDriver(PostgresDialectPoolConfig.of(pool));
    driver.init();

    DatabaseConnection c = driver.acquireConnection();
    for (int i = 0; i < 5; i++) {
      System.gc();
      Thread.sleep(10);
    }

    assertEquals(1L, driver.trackedConnections());
    c.executeQuery(CompiledQuery.raw("select 1"));
    driver.releaseConnection(c);
  }

  private static WeakReference<PostgresClient> checkOutAndRelease(PostgresDriver driver) {
    DatabaseConnection c = driver.acquireConnection();
    c.executeQuery(CompiledQuery.raw("select 1"));
    PostgresClient handle = ((PostgresConnection) c).client();
    driver.releaseConnection(c);
    assertEquals(1L, driver.trackedConnections());
    return new WeakReference<>(handle);
  }
}
