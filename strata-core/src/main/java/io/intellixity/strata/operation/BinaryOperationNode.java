package io.intellixity.strata.operation;

import java.util.Objects;

public record BinaryOperationNode(OperationNode left, OperatorNode operator, OperationNode right)
    implements OperationNode {
  public BinaryOperationNode {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(right, "right");
  }

  public static BinaryOperationNode create(OperationNode left, Operator operator, OperationNode right) {
    return new BinaryOperationNode(left, OperatorNode.create(operator), right);
  }

  @Override public NodeKind kind() { return NodeKind.BINARY_OPERATION; }
}
