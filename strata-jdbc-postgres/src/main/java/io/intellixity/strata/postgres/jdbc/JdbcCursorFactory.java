package io.intellixity.strata.postgres.jdbc;

import io.intellixity.strata.postgres.client.PostgresClient;
import io.intellixity.strata.postgres.client.PostgresCursor;
import io.intellixity.strata.postgres.client.PostgresCursorFactory;

import java.sql.SQLException;
import java.util.List;

/** Opens {@link JdbcCursor}s on clients from this package. */
public final class JdbcCursorFactory implements PostgresCursorFactory {
  @Override
  public PostgresCursor create(PostgresClient client, String sql, List<Object> parameters) throws SQLException {
    if (!(client instanceof JdbcPostgresClient jc)) {
      throw new IllegalArgumentException("JdbcCursorFactory needs a JDBC-backed client, got: " + client.getClass().getName());
    }
    return new JdbcCursor(jc.connection(), !jc.inTransaction(), PlaceholderRewriter.rewrite(sql, parameters));
  }
}
