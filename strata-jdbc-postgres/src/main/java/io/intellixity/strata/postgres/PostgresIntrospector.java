package io.intellixity.strata.postgres;

import io.intellixity.strata.compiler.CompiledQuery;
import io.intellixity.strata.dialect.ColumnMetadata;
import io.intellixity.strata.dialect.DatabaseIntrospector;
import io.intellixity.strata.dialect.SchemaMetadata;
import io.intellixity.strata.dialect.TableMetadata;
import io.intellixity.strata.driver.ConnectionProvider;
import io.intellixity.strata.driver.QueryResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Schema metadata from {@code information_schema}, system schemas excluded. */
public final class PostgresIntrospector implements DatabaseIntrospector {
  static final String SCHEMAS_SQL =
      "select schema_name from information_schema.schemata"
          + " where schema_name not in ('pg_catalog', 'information_schema')"
          + " and schema_name not like 'pg_toast%' and schema_name not like 'pg_temp%'"
          + " order by schema_name";

  static final String COLUMNS_SQL =
      "select c.table_schema, c.table_name, t.table_type, c.column_name, c.data_type, c.is_nullable, c.column_default"
          + " from information_schema.columns c"
          + " join information_schema.tables t on t.table_schema = c.table_schema and t.table_name = c.table_name"
          + " where c.table_schema not in ('pg_catalog', 'information_schema')"
          + " and c.table_schema not like 'pg_toast%'"
          + " order by c.table_schema, c.table_name, c.ordinal_position";

  private final ConnectionProvider connections;

  public PostgresIntrospector(ConnectionProvider connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  @Override
  public List<SchemaMetadata> getSchemas() {
    QueryResult r = connections.withConnection(c -> c.executeQuery(CompiledQuery.raw(SCHEMAS_SQL)));
    return r.rows().stream().map(row -> new SchemaMetadata(String.valueOf(row.get("schema_name")))).toList();
  }

  @Override
  public List<TableMetadata> getTables(boolean withInternalTables) {
    QueryResult r = connections.withConnection(c -> c.executeQuery(CompiledQuery.raw(COLUMNS_SQL)));
    Map<String, TableBuilder> tables = new LinkedHashMap<>();
    for (Map<String, Object> row : r.rows()) {
      String schema = (String) row.get("table_schema");
      String name = (String) row.get("table_name");
      if (!withInternalTables && isInternal(name)) continue;
      TableBuilder tb = tables.computeIfAbsent(schema + "." + name,
          k -> new TableBuilder(name, schema, "VIEW".equals(row.get("table_type"))));
      tb.columns.add(new ColumnMetadata(
          (String) row.get("column_name"),
          (String) row.get("data_type"),
          "YES".equals(row.get("is_nullable")),
          row.get("column_default") != null));
    }
    List<TableMetadata> out = new ArrayList<>(tables.size());
    for (TableBuilder tb : tables.values()) out.add(new TableMetadata(tb.name, tb.schema, tb.view, tb.columns));
    return out;
  }

  private static boolean isInternal(String table) {
    return DEFAULT_MIGRATION_TABLE.equals(table) || DEFAULT_MIGRATION_LOCK_TABLE.equals(table);
  }

  private static final class TableBuilder {
    final String name;
    final String schema;
    final boolean view;
    final List<ColumnMetadata> columns = new ArrayList<>();

    TableBuilder(String name, String schema, boolean view) {
      this.name = name;
      this.schema = schema;
      this.view = view;
    }
  }
}
