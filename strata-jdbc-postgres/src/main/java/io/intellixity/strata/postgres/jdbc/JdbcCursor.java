package io.intellixity.strata.postgres.jdbc;

import io.intellixity.strata.postgres.client.PostgresCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Forward-only result set read in batches.
 *
 * pgjdbc only fetches in batches (through a server-side portal) when autocommit is off, so
 * outside an explicit transaction autocommit is switched off until {@link #close()}.
 * The statement runs on the first {@link #read(int)}, with fetch size equal to that batch size.
 */
public final class JdbcCursor implements PostgresCursor {
  private static final Logger log = LoggerFactory.getLogger(JdbcCursor.class);

  private final Connection connection;
  private final boolean manageAutoCommit;
  private final PlaceholderRewriter.JdbcStatement statement;

  private PreparedStatement ps;
  private ResultSet rs;
  private boolean restoreAutoCommit;
  private boolean closed;

  JdbcCursor(Connection connection, boolean manageAutoCommit, PlaceholderRewriter.JdbcStatement statement) {
    this.connection = connection;
    this.manageAutoCommit = manageAutoCommit;
    this.statement = statement;
  }

  @Override
  public List<Map<String, Object>> read(int maxRows) throws SQLException {
    if (closed) throw new SQLException("Cursor is closed");
    if (rs == null) open(maxRows);
    return ResultSetRows.readUpTo(rs, maxRows);
  }

  private void open(int fetchSize) throws SQLException {
    if (manageAutoCommit && connection.getAutoCommit()) {
      connection.setAutoCommit(false);
      restoreAutoCommit = true;
    }
    ps = connection.prepareStatement(statement.sql(), ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
    ps.setFetchSize(fetchSize);
    PostgresParameterBinder.bindAll(ps, statement.parameters());
    rs = ps.executeQuery();
    log.debug("strata.jdbc op=cursor_open fetchSize={} restoreAutoCommit={}", fetchSize, restoreAutoCommit);
  }

  @Override
  public void close() throws SQLException {
    if (closed) return;
    closed = true;
    SQLException failure = null;
    try {
      if (rs != null) rs.close();
    } catch (SQLException e) {
      failure = e;
    }
    try {
      if (ps != null) ps.close();
    } catch (SQLException e) {
      failure = chain(failure, e);
    }
    if (restoreAutoCommit) {
      try {
        // Ends the read-only transaction the cursor ran in.
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        failure = chain(failure, e);
      }
    }
    if (failure != null) throw failure;
  }

  private static SQLException chain(SQLException first, SQLException next) {
    if (first == null) return next;
    first.addSuppressed(next);
    return first;
  }
}
