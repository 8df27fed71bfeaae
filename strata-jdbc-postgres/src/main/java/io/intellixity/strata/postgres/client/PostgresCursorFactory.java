package io.intellixity.strata.postgres.client;

import java.sql.SQLException;
import java.util.List;

/** Opens server-side cursors on a client. */
public interface PostgresCursorFactory {
  PostgresCursor create(PostgresClient client, String sql, List<Object> parameters) throws SQLException;
}
