package io.intellixity.strata.operation;

import java.util.Objects;

public record OnNode(OperationNode on) implements OperationNode {
  public OnNode {
    Objects.requireNonNull(on, "on");
  }

  public static OnNode create(OperationNode on) {
    return new OnNode(on);
  }

  /** Combines this clause with another predicate using AND. */
  public OnNode cloneWithAnd(OperationNode other) {
    return new OnNode(AndNode.create(on, other));
  }

  /** Combines this clause with another predicate using OR. */
  public OnNode cloneWithOr(OperationNode other) {
    return new OnNode(OrNode.create(on, other));
  }

  @Override public NodeKind kind() { return NodeKind.ON; }
}
