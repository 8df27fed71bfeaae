package io.intellixity.strata.postgres.jdbc;

import io.intellixity.strata.postgres.client.NativeQueryResult;
import io.intellixity.strata.postgres.client.PostgresClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Native client over a JDBC {@link Connection}.
 *
 * Statements are rewritten from {@code $n} to {@code ?} binds and run as prepared statements.
 * Transaction statements sent as SQL are tracked so cursors know whether they run inside one.
 */
public abstract class JdbcPostgresClient implements PostgresClient {
  private static final Logger log = LoggerFactory.getLogger(JdbcPostgresClient.class);

  private static final Set<String> TX_START = Set.of("BEGIN", "START");
  private static final Set<String> TX_END = Set.of("COMMIT", "ROLLBACK", "END", "ABORT");

  private volatile boolean inTransaction;

  /** The connection statements run on. */
  protected abstract Connection connection() throws SQLException;

  /** True between a {@code begin}/{@code start transaction} and the matching commit or rollback. */
  public final boolean inTransaction() {
    return inTransaction;
  }

  @Override
  public final NativeQueryResult query(String sql, List<Object> parameters) throws SQLException {
    PlaceholderRewriter.JdbcStatement stmt = PlaceholderRewriter.rewrite(sql, parameters);
    String command = CommandTags.commandOf(sql);
    Connection c = connection();
    long start = System.nanoTime();
    NativeQueryResult result;
    try (PreparedStatement ps = c.prepareStatement(stmt.sql())) {
      PostgresParameterBinder.bindAll(ps, stmt.parameters());
      if (ps.execute()) {
        try (ResultSet rs = ps.getResultSet()) {
          List<Map<String, Object>> rows = ResultSetRows.readAll(rs);
          result = new NativeQueryResult(command, (long) rows.size(), rows);
        }
      } else {
        long count = ps.getLargeUpdateCount();
        result = new NativeQueryResult(command, count < 0 ? null : count, List.of());
      }
    }
    trackTransaction(command);
    if (log.isDebugEnabled()) {
      log.debug("strata.jdbc_done command={} durationMs={} rowCount={}",
          command, (System.nanoTime() - start) / 1_000_000.0, result.rowCount());
    }
    return result;
  }

  private void trackTransaction(String command) {
    if (command == null) return;
    if (TX_START.contains(command)) inTransaction = true;
    else if (TX_END.contains(command)) inTransaction = false;
  }

  /** Forgets transaction state, e.g. when the physical connection changes hands. */
  protected final void resetTransactionState() {
    inTransaction = false;
  }
}
