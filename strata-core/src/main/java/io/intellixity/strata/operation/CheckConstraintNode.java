package io.intellixity.strata.operation;

import java.util.Objects;

public record CheckConstraintNode(OperationNode expression, IdentifierNode name) implements ConstraintNode {
  public CheckConstraintNode {
    Objects.requireNonNull(expression, "expression");
  }

  public static CheckConstraintNode create(OperationNode expression, String name) {
    return new CheckConstraintNode(expression, name == null ? null : IdentifierNode.create(name));
  }

  @Override public NodeKind kind() { return NodeKind.CHECK_CONSTRAINT; }
}
