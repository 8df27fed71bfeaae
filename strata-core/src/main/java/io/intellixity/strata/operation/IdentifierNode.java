package io.intellixity.strata.operation;

/** Bare SQL identifier; quoting is left to the dialect compiler. */
public record IdentifierNode(String name) implements OperationNode {
  public IdentifierNode {
    Nodes.requireText(name, "name");
  }

  public static IdentifierNode create(String name) {
    return new IdentifierNode(name);
  }

  @Override public NodeKind kind() { return NodeKind.IDENTIFIER; }
}
