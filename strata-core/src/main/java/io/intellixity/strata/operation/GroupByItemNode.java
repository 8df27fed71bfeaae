package io.intellixity.strata.operation;

import java.util.Objects;

public record GroupByItemNode(OperationNode groupBy) implements OperationNode {
  public GroupByItemNode {
    Objects.requireNonNull(groupBy, "groupBy");
  }

  public static GroupByItemNode create(OperationNode groupBy) {
    return new GroupByItemNode(groupBy);
  }

  @Override public NodeKind kind() { return NodeKind.GROUP_BY_ITEM; }
}
