package io.intellixity.strata.postgres;

import io.intellixity.strata.compiler.CompiledQuery;
import io.intellixity.strata.dialect.DialectAdapter;
import io.intellixity.strata.dialect.MigrationLockOptions;
import io.intellixity.strata.driver.DatabaseConnection;

import java.util.List;

public final class PostgresAdapter implements DialectAdapter {
  /** Arbitrary key shared by every process that migrates the same database. */
  static final long MIGRATION_LOCK_ID = 3853314791062309107L;

  @Override public boolean supportsTransactionalDdl() { return true; }
  @Override public boolean supportsReturning() { return true; }

  /** Transaction-scoped advisory lock; released automatically at commit or rollback. */
  @Override
  public void acquireMigrationLock(DatabaseConnection connection, MigrationLockOptions options) {
    connection.executeQuery(CompiledQuery.raw("select pg_advisory_xact_lock($1)", List.of(MIGRATION_LOCK_ID)));
  }

  @Override
  public void releaseMigrationLock(DatabaseConnection connection, MigrationLockOptions options) {
    // Nothing to do: the xact lock ends with the transaction.
  }
}
