package io.intellixity.strata.operation;

import java.util.Objects;

/** {@code DROP CONSTRAINT "name"}; the constraint name is the only child. */
public record DropConstraintNode(IdentifierNode constraintName) implements AlterTableActionNode {
  public DropConstraintNode {
    Objects.requireNonNull(constraintName, "constraintName");
  }

  public static DropConstraintNode create(String constraintName) {
    return new DropConstraintNode(IdentifierNode.create(constraintName));
  }

  @Override public NodeKind kind() { return NodeKind.DROP_CONSTRAINT; }
}
