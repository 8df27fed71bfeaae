package io.intellixity.strata.postgres.client;

import java.sql.SQLException;
import java.util.List;

/** A native client that can run statements with {@code $n} placeholders. */
public interface PostgresClient {
  NativeQueryResult query(String sql, List<Object> parameters) throws SQLException;
}
