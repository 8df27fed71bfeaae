package io.intellixity.strata.operation;

import java.util.Objects;

/** One item of a select list (or of RETURNING). */
public record SelectionNode(OperationNode selection) implements OperationNode {
  public SelectionNode {
    Objects.requireNonNull(selection, "selection");
  }

  public static SelectionNode create(OperationNode selection) {
    return new SelectionNode(selection);
  }

  public static SelectionNode createSelectAll() {
    return new SelectionNode(SelectAllNode.create());
  }

  @Override public NodeKind kind() { return NodeKind.SELECTION; }
}
