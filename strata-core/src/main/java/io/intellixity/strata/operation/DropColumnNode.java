package io.intellixity.strata.operation;

import java.util.Objects;

public record DropColumnNode(ColumnNode column) implements AlterTableActionNode {
  public DropColumnNode {
    Objects.requireNonNull(column, "column");
  }

  public static DropColumnNode create(String column) {
    return new DropColumnNode(ColumnNode.create(column));
  }

  @Override public NodeKind kind() { return NodeKind.DROP_COLUMN; }
}
