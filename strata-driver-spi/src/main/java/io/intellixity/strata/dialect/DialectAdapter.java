package io.intellixity.strata.dialect;

import io.intellixity.strata.driver.DatabaseConnection;

/** Capability flags and migration hooks that differ per database. */
public interface DialectAdapter {
  boolean supportsTransactionalDdl();

  boolean supportsReturning();

  default boolean supportsCreateIfNotExists() {
    return true;
  }

  /** Blocks until this connection holds the migration lock. Called inside a transaction. */
  void acquireMigrationLock(DatabaseConnection connection, MigrationLockOptions options);

  void releaseMigrationLock(DatabaseConnection connection, MigrationLockOptions options);
}
