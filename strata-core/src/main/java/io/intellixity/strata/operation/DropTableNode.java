package io.intellixity.strata.operation;

import java.util.Objects;

public record DropTableNode(TableNode table, boolean ifExists, boolean cascade) implements RootOperationNode {
  public DropTableNode {
    Objects.requireNonNull(table, "table");
  }

  public static DropTableNode create(TableNode table) {
    return new DropTableNode(table, false, false);
  }

  public DropTableNode withIfExists() {
    return new DropTableNode(table, true, cascade);
  }

  public DropTableNode withCascade() {
    return new DropTableNode(table, ifExists, true);
  }

  @Override public NodeKind kind() { return NodeKind.DROP_TABLE; }
}
