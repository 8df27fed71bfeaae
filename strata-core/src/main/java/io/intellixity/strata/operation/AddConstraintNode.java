package io.intellixity.strata.operation;

import java.util.Objects;

public record AddConstraintNode(ConstraintNode constraint) implements AlterTableActionNode {
  public AddConstraintNode {
    Objects.requireNonNull(constraint, "constraint");
  }

  public static AddConstraintNode create(ConstraintNode constraint) {
    return new AddConstraintNode(constraint);
  }

  @Override public NodeKind kind() { return NodeKind.ADD_CONSTRAINT; }
}
