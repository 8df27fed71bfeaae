package io.intellixity.strata.dialect;

import java.util.Objects;

/**
 * @param lockTable name of the migration lock table
 * @param lockRowId id of the lock row inside it
 * @param lockTableSchema schema of the lock table, or null
 */
public record MigrationLockOptions(String lockTable, String lockRowId, String lockTableSchema) {
  public MigrationLockOptions {
    Objects.requireNonNull(lockTable, "lockTable");
    Objects.requireNonNull(lockRowId, "lockRowId");
  }

  public static MigrationLockOptions defaults() {
    return new MigrationLockOptions(DatabaseIntrospector.DEFAULT_MIGRATION_LOCK_TABLE, "migration_lock", null);
  }
}
