package io.intellixity.strata.dialect;

import java.util.List;

/** Reads schema metadata from a live database. */
public interface DatabaseIntrospector {
  String DEFAULT_MIGRATION_TABLE = "strata_migration";
  String DEFAULT_MIGRATION_LOCK_TABLE = "strata_migration_lock";

  List<SchemaMetadata> getSchemas();

  /**
   * @param withInternalTables include the migration bookkeeping tables
   */
  List<TableMetadata> getTables(boolean withInternalTables);
}
