package io.intellixity.strata.postgres.jdbc;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.strata.postgres.config.PostgresConnectionSettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresPoolsTest {
  @Test
  void mapsSettingsOntoHikariConfig() {
    PostgresConnectionSettings s = new PostgresConnectionSettings(
        "jdbc:postgresql://db:5432/app", "app", "pw", "tenant_a", 4, 1, 5_000L, "billing", true);

    HikariConfig cfg = PostgresPools.hikariConfig(s);

    assertEquals("jdbc:postgresql://db:5432/app", cfg.getJdbcUrl());
    assertEquals("app", cfg.getUsername());
    assertEquals("tenant_a", cfg.getSchema());
    assertEquals(4, cfg.getMaximumPoolSize());
    assertEquals(1, cfg.getMinimumIdle());
    assertEquals(5_000L, cfg.getConnectionTimeout());
    assertEquals("billing-pool", cfg.getPoolName());
    assertEquals("billing", cfg.getDataSourceProperties().getProperty("ApplicationName"));
  }
}
