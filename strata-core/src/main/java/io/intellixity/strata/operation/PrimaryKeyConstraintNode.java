package io.intellixity.strata.operation;

import java.util.List;

public record PrimaryKeyConstraintNode(List<ColumnNode> columns, IdentifierNode name) implements ConstraintNode {
  public PrimaryKeyConstraintNode {
    columns = Nodes.copyNonEmpty(columns, "columns");
  }

  public static PrimaryKeyConstraintNode create(List<String> columns, String name) {
    return new PrimaryKeyConstraintNode(ColumnNode.createAll(columns), name == null ? null : IdentifierNode.create(name));
  }

  @Override public NodeKind kind() { return NodeKind.PRIMARY_KEY_CONSTRAINT; }
}
