package io.intellixity.strata.operation;

import java.util.Objects;

public record AddColumnNode(ColumnDefinitionNode column) implements AlterTableActionNode {
  public AddColumnNode {
    Objects.requireNonNull(column, "column");
  }

  public static AddColumnNode create(ColumnDefinitionNode column) {
    return new AddColumnNode(column);
  }

  @Override public NodeKind kind() { return NodeKind.ADD_COLUMN; }
}
