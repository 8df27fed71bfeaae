package io.intellixity.strata.operation;

import java.util.List;
import java.util.Objects;

public record ColumnNode(IdentifierNode column) implements OperationNode {
  public ColumnNode {
    Objects.requireNonNull(column, "column");
  }

  public static ColumnNode create(String column) {
    return new ColumnNode(IdentifierNode.create(column));
  }

  public static List<ColumnNode> createAll(List<String> columns) {
    return Objects.requireNonNull(columns, "columns").stream().map(ColumnNode::create).toList();
  }

  @Override public NodeKind kind() { return NodeKind.COLUMN; }
}
