package io.intellixity.strata.operation;

import java.util.List;

public record OrderByNode(List<OrderByItemNode> items) implements OperationNode {
  public OrderByNode {
    items = Nodes.copyNonEmpty(items, "items");
  }

  public static OrderByNode create(List<OrderByItemNode> items) {
    return new OrderByNode(items);
  }

  @Override public NodeKind kind() { return NodeKind.ORDER_BY; }
}
