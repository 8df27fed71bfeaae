package io.intellixity.strata.operation;

import java.util.Objects;

public record DropIndexNode(SchemableIdentifierNode name, boolean ifExists, boolean cascade) implements RootOperationNode {
  public DropIndexNode {
    Objects.requireNonNull(name, "name");
  }

  public static DropIndexNode create(String name) {
    return new DropIndexNode(SchemableIdentifierNode.create(name), false, false);
  }

  public DropIndexNode withIfExists() {
    return new DropIndexNode(name, true, cascade);
  }

  public DropIndexNode withCascade() {
    return new DropIndexNode(name, ifExists, true);
  }

  @Override public NodeKind kind() { return NodeKind.DROP_INDEX; }
}
