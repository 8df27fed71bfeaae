package io.intellixity.strata.operation;

import java.util.Objects;

public record ParensNode(OperationNode node) implements OperationNode {
  public ParensNode {
    Objects.requireNonNull(node, "node");
  }

  public static ParensNode create(OperationNode node) {
    return new ParensNode(node);
  }

  @Override public NodeKind kind() { return NodeKind.PARENS; }
}
