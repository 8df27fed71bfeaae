package io.intellixity.strata.postgres.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the native client reports for one statement.
 *
 * @param command leading command keyword (INSERT, UPDATE, SELECT, ...), or null if unknown
 * @param rowCount affected or returned row count, or null if the client did not report one
 * @param rows returned rows, column name to value; empty for statements without a result set
 */
public record NativeQueryResult(String command, Long rowCount, List<Map<String, Object>> rows) {
  public NativeQueryResult {
    rows = (rows == null) ? List.of()
        : rows.stream().map(r -> Collections.unmodifiableMap(new LinkedHashMap<>(r))).toList();
  }
}
