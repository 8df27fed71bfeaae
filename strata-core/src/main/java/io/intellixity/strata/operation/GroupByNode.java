package io.intellixity.strata.operation;

import java.util.List;

public record GroupByNode(List<GroupByItemNode> items) implements OperationNode {
  public GroupByNode {
    items = Nodes.copyNonEmpty(items, "items");
  }

  public static GroupByNode create(List<GroupByItemNode> items) {
    return new GroupByNode(items);
  }

  @Override public NodeKind kind() { return NodeKind.GROUP_BY; }
}
