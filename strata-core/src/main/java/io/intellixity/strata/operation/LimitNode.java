package io.intellixity.strata.operation;

import java.util.Objects;

public record LimitNode(OperationNode limit) implements OperationNode {
  public LimitNode {
    Objects.requireNonNull(limit, "limit");
  }

  public static LimitNode create(long limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    return new LimitNode(ValueNode.create(limit));
  }

  @Override public NodeKind kind() { return NodeKind.LIMIT; }
}
