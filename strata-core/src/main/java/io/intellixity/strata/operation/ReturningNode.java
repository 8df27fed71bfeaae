package io.intellixity.strata.operation;

import java.util.List;

public record ReturningNode(List<SelectionNode> selections) implements OperationNode {
  public ReturningNode {
    selections = Nodes.copyNonEmpty(selections, "selections");
  }

  public static ReturningNode create(List<SelectionNode> selections) {
    return new ReturningNode(selections);
  }

  public static ReturningNode createColumns(String... columns) {
    return new ReturningNode(List.of(columns).stream().map(c -> SelectionNode.create(ReferenceNode.create(c))).toList());
  }

  @Override public NodeKind kind() { return NodeKind.RETURNING; }
}
