package io.intellixity.strata.operation;

import java.util.Objects;

public record AndNode(OperationNode left, OperationNode right) implements OperationNode {
  public AndNode {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  public static AndNode create(OperationNode left, OperationNode right) {
    return new AndNode(left, right);
  }

  @Override public NodeKind kind() { return NodeKind.AND; }
}
