package io.intellixity.strata.operation;

import java.util.List;

public record UniqueConstraintNode(List<ColumnNode> columns, IdentifierNode name) implements ConstraintNode {
  public UniqueConstraintNode {
    columns = Nodes.copyNonEmpty(columns, "columns");
  }

  public static UniqueConstraintNode create(List<String> columns, String name) {
    return new UniqueConstraintNode(ColumnNode.createAll(columns), name == null ? null : IdentifierNode.create(name));
  }

  @Override public NodeKind kind() { return NodeKind.UNIQUE_CONSTRAINT; }
}
