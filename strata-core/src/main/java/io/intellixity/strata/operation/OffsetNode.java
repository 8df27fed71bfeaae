package io.intellixity.strata.operation;

import java.util.Objects;

public record OffsetNode(OperationNode offset) implements OperationNode {
  public OffsetNode {
    Objects.requireNonNull(offset, "offset");
  }

  public static OffsetNode create(long offset) {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    return new OffsetNode(ValueNode.create(offset));
  }

  @Override public NodeKind kind() { return NodeKind.OFFSET; }
}
