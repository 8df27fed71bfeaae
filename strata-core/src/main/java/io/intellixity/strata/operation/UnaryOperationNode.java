package io.intellixity.strata.operation;

import java.util.Objects;

/** Prefix operator applied to one operand: NOT, EXISTS, unary minus. */
public record UnaryOperationNode(OperatorNode operator, OperationNode operand) implements OperationNode {
  public UnaryOperationNode {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(operand, "operand");
  }

  public static UnaryOperationNode create(Operator operator, OperationNode operand) {
    return new UnaryOperationNode(OperatorNode.create(operator), operand);
  }

  @Override public NodeKind kind() { return NodeKind.UNARY_OPERATION; }
}
