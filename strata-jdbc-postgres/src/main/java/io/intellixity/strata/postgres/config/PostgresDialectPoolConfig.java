package io.intellixity.strata.postgres.config;

import io.intellixity.strata.postgres.client.PostgresCursorFactory;
import io.intellixity.strata.postgres.client.PostgresPool;
import io.intellixity.strata.util.Lazy;

import java.util.Objects;

/**
 * Pool mode.
 *
 * @param pool the pool; resolved on driver init
 * @param cursor cursor factory for streaming, or null
 * @param onCreateConnection hook run once per new pooled connection, or null
 */
public record PostgresDialectPoolConfig(
    Lazy<PostgresPool> pool,
    PostgresCursorFactory cursor,
    ConnectionHook onCreateConnection
) implements PostgresDialectConfig {
  public PostgresDialectPoolConfig {
    Objects.requireNonNull(pool, "pool");
  }

  public static PostgresDialectPoolConfig of(PostgresPool pool) {
    return new PostgresDialectPoolConfig(Lazy.resolved(pool), null, null);
  }

  /** The factory runs on the first {@code init}, at most once. */
  public static PostgresDialectPoolConfig lazy(ResourceFactory<? extends PostgresPool> factory) {
    return new PostgresDialectPoolConfig(PostgresDialectConfig.lazyResource(factory), null, null);
  }

  public PostgresDialectPoolConfig withCursor(PostgresCursorFactory c) {
    return new PostgresDialectPoolConfig(pool, c, onCreateConnection);
  }

  public PostgresDialectPoolConfig withOnCreateConnection(ConnectionHook hook) {
    return new PostgresDialectPoolConfig(pool, cursor, hook);
  }
}
