package io.intellixity.strata.operation;

import java.util.Objects;

public record HavingNode(OperationNode having) implements OperationNode {
  public HavingNode {
    Objects.requireNonNull(having, "having");
  }

  public static HavingNode create(OperationNode having) {
    return new HavingNode(having);
  }

  /** Combines this clause with another predicate using AND. */
  public HavingNode cloneWithAnd(OperationNode other) {
    return new HavingNode(AndNode.create(having, other));
  }

  /** Combines this clause with another predicate using OR. */
  public HavingNode cloneWithOr(OperationNode other) {
    return new HavingNode(OrNode.create(having, other));
  }

  @Override public NodeKind kind() { return NodeKind.HAVING; }
}
