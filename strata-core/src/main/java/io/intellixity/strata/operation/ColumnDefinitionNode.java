package io.intellixity.strata.operation;

import java.util.Objects;

/**
 * Column inside CREATE TABLE / ADD COLUMN.
 *
 * @param defaultTo default expression, or null; values should be immediate since DDL takes no parameters
 */
public record ColumnDefinitionNode(
    ColumnNode column,
    DataTypeNode dataType,
    boolean primaryKey,
    boolean notNull,
    boolean unique,
    OperationNode defaultTo
) implements OperationNode {
  public ColumnDefinitionNode {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(dataType, "dataType");
  }

  public static ColumnDefinitionNode create(String column, String dataType) {
    return new ColumnDefinitionNode(ColumnNode.create(column), DataTypeNode.create(dataType), false, false, false, null);
  }

  public ColumnDefinitionNode withPrimaryKey() {
    return new ColumnDefinitionNode(column, dataType, true, notNull, unique, defaultTo);
  }

  public ColumnDefinitionNode withNotNull() {
    return new ColumnDefinitionNode(column, dataType, primaryKey, true, unique, defaultTo);
  }

  public ColumnDefinitionNode withUnique() {
    return new ColumnDefinitionNode(column, dataType, primaryKey, notNull, true, defaultTo);
  }

  public ColumnDefinitionNode withDefaultTo(OperationNode value) {
    return new ColumnDefinitionNode(column, dataType, primaryKey, notNull, unique, value);
  }

  @Override public NodeKind kind() { return NodeKind.COLUMN_DEFINITION; }
}
