package io.intellixity.strata.postgres.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads result set rows into column-ordered maps keyed by column label. */
final class ResultSetRows {
  private ResultSetRows() {}

  static List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    return readUpTo(rs, Integer.MAX_VALUE);
  }

  static List<Map<String, Object>> readUpTo(ResultSet rs, int maxRows) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int columns = md.getColumnCount();
    List<Map<String, Object>> out = new ArrayList<>();
    while (out.size() < maxRows && rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int c = 1; c <= columns; c++) {
        row.put(md.getColumnLabel(c), rs.getObject(c));
      }
      out.add(row);
    }
    return out;
  }
}
