package io.intellixity.strata.operation;

import java.util.Objects;

public record OrNode(OperationNode left, OperationNode right) implements OperationNode {
  public OrNode {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  public static OrNode create(OperationNode left, OperationNode right) {
    return new OrNode(left, right);
  }

  @Override public NodeKind kind() { return NodeKind.OR; }
}
