package io.intellixity.strata.postgres;

import io.intellixity.strata.compiler.QueryCompiler;
import io.intellixity.strata.dialect.DatabaseIntrospector;
import io.intellixity.strata.dialect.Dialect;
import io.intellixity.strata.dialect.DialectAdapter;
import io.intellixity.strata.driver.ConnectionProvider;
import io.intellixity.strata.driver.Driver;
import io.intellixity.strata.postgres.config.PostgresConnectionSettings;
import io.intellixity.strata.postgres.config.PostgresDialectConfig;
import io.intellixity.strata.postgres.config.PostgresDialectPoolConfig;
import io.intellixity.strata.postgres.jdbc.JdbcCursorFactory;
import io.intellixity.strata.postgres.jdbc.PostgresPools;

import java.util.Objects;

/** Postgres dialect: driver, compiler, adapter and introspector for one configuration. */
public final class PostgresDialect implements Dialect {
  private final PostgresDialectConfig config;

  public PostgresDialect(PostgresDialectConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /** HikariCP pool built lazily from {@code settings}, with JDBC cursors when streaming is on. */
  public static PostgresDialect fromSettings(PostgresConnectionSettings settings) {
    Objects.requireNonNull(settings, "settings");
    PostgresDialectPoolConfig cfg = PostgresDialectPoolConfig.lazy(() -> PostgresPools.create(settings));
    if (settings.streaming()) cfg = cfg.withCursor(new JdbcCursorFactory());
    return new PostgresDialect(cfg);
  }

  public PostgresDialectConfig config() {
    return config;
  }

  @Override public Driver createDriver() { return new PostgresDriver(config); }
  @Override public QueryCompiler createQueryCompiler() { return new PostgresQueryCompiler(); }
  @Override public DialectAdapter createAdapter() { return new PostgresAdapter(); }

  @Override
  public DatabaseIntrospector createIntrospector(ConnectionProvider connections) {
    return new PostgresIntrospector(connections);
  }
}
