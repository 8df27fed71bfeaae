package io.intellixity.strata.postgres.config;

import io.intellixity.strata.driver.DatabaseConnection;

/** Runs once for every new pooled connection, before it is handed to the caller. */
@FunctionalInterface
public interface ConnectionHook {
  void onCreateConnection(DatabaseConnection connection);
}
