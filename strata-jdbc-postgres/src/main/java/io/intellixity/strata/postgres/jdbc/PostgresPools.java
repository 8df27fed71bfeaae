package io.intellixity.strata.postgres.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.strata.postgres.config.PostgresConnectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Builds HikariCP pools from {@link PostgresConnectionSettings}. */
public final class PostgresPools {
  private static final Logger log = LoggerFactory.getLogger(PostgresPools.class);

  private PostgresPools() {}

  public static HikariConfig hikariConfig(PostgresConnectionSettings settings) {
    Objects.requireNonNull(settings, "settings");
    HikariConfig cfg = new HikariConfig();
    cfg.setJdbcUrl(settings.jdbcUrl());
    if (settings.username() != null) cfg.setUsername(settings.username());
    if (settings.password() != null) cfg.setPassword(settings.password());
    if (settings.schema() != null) cfg.setSchema(settings.schema());
    cfg.setMaximumPoolSize(settings.maximumPoolSize());
    if (settings.minimumIdle() != null) cfg.setMinimumIdle(settings.minimumIdle());
    cfg.setConnectionTimeout(settings.connectionTimeoutMs());
    cfg.setPoolName(settings.applicationName() + "-pool");
    cfg.addDataSourceProperty("ApplicationName", settings.applicationName());
    return cfg;
  }

  public static DataSourcePostgresPool create(PostgresConnectionSettings settings) {
    HikariConfig cfg = hikariConfig(settings);
    log.debug("strata.jdbc op=create_pool settings={}", settings);
    return new DataSourcePostgresPool(new HikariDataSource(cfg));
  }
}
