package io.intellixity.strata.dialect;

import java.util.Objects;

/**
 * @param dataType database type name as reported by the catalog
 * @param hasDefaultValue true when the column has a default (including serial/identity)
 */
public record ColumnMetadata(String name, String dataType, boolean nullable, boolean hasDefaultValue) {
  public ColumnMetadata {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(dataType, "dataType");
  }
}
