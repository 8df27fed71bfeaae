package io.intellixity.strata.dialect;

import java.util.List;
import java.util.Objects;

/**
 * @param schema owning schema, or null where the database has none
 */
public record TableMetadata(String name, String schema, boolean view, List<ColumnMetadata> columns) {
  public TableMetadata {
    Objects.requireNonNull(name, "name");
    columns = (columns == null) ? List.of() : List.copyOf(columns);
  }
}
