package io.intellixity.strata.postgres.config;

import io.intellixity.strata.error.DatabaseException;
import io.intellixity.strata.postgres.client.PostgresCursorFactory;
import io.intellixity.strata.util.Lazy;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Postgres dialect configuration: either a pool ({@link PostgresDialectPoolConfig}) or a single
 * long-lived client ({@link PostgresDialectClientConfig}).
 */
public sealed interface PostgresDialectConfig permits PostgresDialectPoolConfig, PostgresDialectClientConfig {
  /** Cursor factory used by streaming queries, or null when streaming is not configured. */
  PostgresCursorFactory cursor();

  static <T> Lazy<T> lazyResource(ResourceFactory<? extends T> factory) {
    Objects.requireNonNull(factory, "factory");
    return Lazy.of(() -> {
      try {
        return factory.create();
      } catch (SQLException e) {
        throw new DatabaseException("Failed to create postgres resource", e);
      }
    });
  }
}
