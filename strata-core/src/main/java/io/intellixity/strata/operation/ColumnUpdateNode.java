package io.intellixity.strata.operation;

import java.util.Objects;

/** {@code "column" = value} inside SET. */
public record ColumnUpdateNode(ColumnNode column, OperationNode value) implements OperationNode {
  public ColumnUpdateNode {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(value, "value");
  }

  public static ColumnUpdateNode create(String column, OperationNode value) {
    return new ColumnUpdateNode(ColumnNode.create(column), value);
  }

  @Override public NodeKind kind() { return NodeKind.COLUMN_UPDATE; }
}
