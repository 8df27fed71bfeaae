package io.intellixity.strata.postgres.client;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

public interface PostgresCursor {
  /** Reads up to {@code maxRows} rows; an empty list means the cursor is exhausted. */
  List<Map<String, Object>> read(int maxRows) throws SQLException;

  void close() throws SQLException;
}
