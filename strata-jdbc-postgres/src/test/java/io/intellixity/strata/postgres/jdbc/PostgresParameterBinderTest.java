package io.intellixity.strata.postgres.jdbc;

import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

final class PostgresParameterBinderTest {
  @Test
  void bindsByValueType() throws Exception {
    PreparedStatement ps = mock(PreparedStatement.class);
    Instant at = Instant.parse("2024-05-01T10:15:30Z");

    PostgresParameterBinder.bindAll(ps, Arrays.asList(Map.of("a", 1), at, null, "text"));

    verify(ps).setObject(eq(1), argThat(o -> o instanceof PGobject p
        && "jsonb".equals(p.getType()) && "{\"a\":1}".equals(p.getValue())));
    verify(ps).setTimestamp(2, Timestamp.from(at));
    verify(ps).setNull(3, Types.NULL);
    verify(ps).setObject(4, "text");
  }
}
