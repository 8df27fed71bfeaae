package io.intellixity.strata.postgres.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Binds positional parameters onto a {@link PreparedStatement}.
 *
 * {@code Map} and {@code List} values go out as {@code jsonb}; {@link Instant} as a timestamp;
 * everything else through {@code setObject}.
 */
public final class PostgresParameterBinder {
  private static final ObjectMapper JSON = new ObjectMapper();

  private PostgresParameterBinder() {}

  public static void bindAll(PreparedStatement ps, List<Object> parameters) throws SQLException {
    for (int i = 0; i < parameters.size(); i++) {
      bind(ps, i + 1, parameters.get(i));
    }
  }

  static void bind(PreparedStatement ps, int pos, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(pos, Types.NULL);
    } else if (value instanceof Map<?, ?> || value instanceof List<?>) {
      PGobject obj = new PGobject();
      obj.setType("jsonb");
      obj.setValue(toJson(value));
      ps.setObject(pos, obj);
    } else if (value instanceof Instant instant) {
      ps.setTimestamp(pos, Timestamp.from(instant));
    } else {
      ps.setObject(pos, value);
    }
  }

  private static String toJson(Object value) throws SQLException {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SQLException("Failed to serialize parameter as jsonb", e);
    }
  }
}
