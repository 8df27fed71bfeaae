package io.intellixity.strata.postgres.jdbc;

import io.intellixity.strata.postgres.client.PostgresCursor;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class JdbcCursorTest {
  private static final String SQL = "select id from person where id > ?";

  private Connection connection;
  private PreparedStatement ps;
  private ResultSet rs;

  private JdbcSingleClient connectedClient(boolean autoCommit) throws Exception {
    DataSource ds = mock(DataSource.class);
    connection = mock(Connection.class);
    ps = mock(PreparedStatement.class);
    rs = mock(ResultSet.class);
    ResultSetMetaData md = mock(ResultSetMetaData.class);
    when(ds.getConnection()).thenReturn(connection);
    when(connection.getAutoCommit()).thenReturn(autoCommit);
    when(connection.prepareStatement(SQL, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)).thenReturn(ps);
    when(ps.executeQuery()).thenReturn(rs);
    when(rs.getMetaData()).thenReturn(md);
    when(md.getColumnCount()).thenReturn(1);
    when(md.getColumnLabel(1)).thenReturn("id");
    when(rs.next()).thenReturn(true, true, true, false);
    when(rs.getObject(1)).thenReturn(1, 2, 3);

    JdbcSingleClient client = JdbcSingleClient.fromDataSource(ds);
    client.connect();
    return client;
  }

  @Test
  void readsInBatchesWithFetchSizeAndRestoresAutoCommit() throws Exception {
    JdbcSingleClient client = connectedClient(true);
    PostgresCursor cursor = new JdbcCursorFactory().create(client, "select id from person where id > $1", List.of(0));

    assertEquals(List.of(Map.of("id", 1), Map.of("id", 2)), cursor.read(2));
    assertEquals(List.of(Map.of("id", 3)), cursor.read(2));
    assertTrue(cursor.read(2).isEmpty());
    cursor.close();
    cursor.close();

    verify(connection).setAutoCommit(false);
    verify(ps).setFetchSize(2);
    verify(ps).setObject(1, 0);
    verify(rs, times(1)).close();
    verify(ps, times(1)).close();
    verify(connection).setAutoCommit(true);
  }

  @Test
  void leavesAutoCommitAloneInsideExplicitTransaction() throws Exception {
    JdbcSingleClient client = connectedClient(true);
    PreparedStatement begin = mock(PreparedStatement.class);
    when(connection.prepareStatement("begin")).thenReturn(begin);
    client.query("begin", List.of());
    assertTrue(client.inTransaction());

    PostgresCursor cursor = new JdbcCursorFactory().create(client, "select id from person where id > $1", List.of(0));
    cursor.read(10);
    cursor.close();

    verify(connection, never()).setAutoCommit(anyBoolean());
  }

  @Test
  void closeBeforeReadDoesNotTouchTheConnection() throws Exception {
    JdbcSingleClient client = connectedClient(true);
    PostgresCursor cursor = new JdbcCursorFactory().create(client, "select 1", List.of());

    cursor.close();

    verify(connection, never()).prepareStatement(anyString(), anyInt(), anyInt());
    verify(connection, never()).setAutoCommit(anyBoolean());
  }
}
