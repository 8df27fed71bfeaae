package io.intellixity.strata.operation;

import java.util.Objects;

public record AliasNode(OperationNode node, IdentifierNode alias) implements OperationNode {
  public AliasNode {
    Objects.requireNonNull(node, "node");
    Objects.requireNonNull(alias, "alias");
  }

  public static AliasNode create(OperationNode node, String alias) {
    return new AliasNode(node, IdentifierNode.create(alias));
  }

  @Override public NodeKind kind() { return NodeKind.ALIAS; }
}
