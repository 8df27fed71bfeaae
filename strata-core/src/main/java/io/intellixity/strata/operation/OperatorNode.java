package io.intellixity.strata.operation;

import java.util.Objects;

public record OperatorNode(Operator operator) implements OperationNode {
  public OperatorNode {
    Objects.requireNonNull(operator, "operator");
  }

  public static OperatorNode create(Operator operator) {
    return new OperatorNode(operator);
  }

  @Override public NodeKind kind() { return NodeKind.OPERATOR; }
}
