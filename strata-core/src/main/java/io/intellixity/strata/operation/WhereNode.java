package io.intellixity.strata.operation;

import java.util.Objects;

public record WhereNode(OperationNode where) implements OperationNode {
  public WhereNode {
    Objects.requireNonNull(where, "where");
  }

  public static WhereNode create(OperationNode where) {
    return new WhereNode(where);
  }

  /** Combines this clause with another predicate using AND. */
  public WhereNode cloneWithAnd(OperationNode other) {
    return new WhereNode(AndNode.create(where, other));
  }

  /** Combines this clause with another predicate using OR. */
  public WhereNode cloneWithOr(OperationNode other) {
    return new WhereNode(OrNode.create(where, other));
  }

  @Override public NodeKind kind() { return NodeKind.WHERE; }
}
