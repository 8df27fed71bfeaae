package io.intellixity.strata.postgres.config;

import io.intellixity.strata.postgres.client.PostgresCursorFactory;
import io.intellixity.strata.postgres.client.PostgresSingleClient;
import io.intellixity.strata.util.Lazy;

import java.util.Objects;

/**
 * Single-client mode: every acquire returns the same connection.
 *
 * @param client the client; resolved and connected on the first acquire
 * @param cursor cursor factory for streaming, or null
 */
public record PostgresDialectClientConfig(
    Lazy<PostgresSingleClient> client,
    PostgresCursorFactory cursor
) implements PostgresDialectConfig {
  public PostgresDialectClientConfig {
    Objects.requireNonNull(client, "client");
  }

  public static PostgresDialectClientConfig of(PostgresSingleClient client) {
    return new PostgresDialectClientConfig(Lazy.resolved(client), null);
  }

  public static PostgresDialectClientConfig lazy(ResourceFactory<? extends PostgresSingleClient> factory) {
    return new PostgresDialectClientConfig(PostgresDialectConfig.lazyResource(factory), null);
  }

  public PostgresDialectClientConfig withCursor(PostgresCursorFactory c) {
    return new PostgresDialectClientConfig(client, c);
  }
}
