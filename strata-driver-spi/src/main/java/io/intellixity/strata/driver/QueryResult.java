package io.intellixity.strata.driver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one statement (or one streamed batch).
 *
 * @param rows result rows, column name to value, in column order; empty when nothing was returned
 * @param numAffectedRows rows touched by INSERT, UPDATE, DELETE or MERGE; null for other statements
 */
public record QueryResult(List<Map<String, Object>> rows, Long numAffectedRows) {
  public QueryResult {
    // Column values may be null, so rows are wrapped rather than Map.copyOf'd.
    rows = (rows == null) ? List.of()
        : rows.stream().map(r -> Collections.unmodifiableMap(new LinkedHashMap<>(r))).toList();
  }

  public static QueryResult ofRows(List<Map<String, Object>> rows) {
    return new QueryResult(rows, null);
  }
}
