package io.intellixity.strata.operation;

import java.util.List;

/** Parenthesized, comma separated list: the right side of IN, or one row of VALUES. */
public record ValueListNode(List<OperationNode> values) implements OperationNode {
  public ValueListNode {
    values = Nodes.copyNonEmpty(values, "values");
  }

  public static ValueListNode create(List<? extends OperationNode> values) {
    return new ValueListNode(List.copyOf(values));
  }

  /** One bound parameter per element. Elements may be null. */
  public static ValueListNode createFromValues(List<?> values) {
    return new ValueListNode(values.stream().map(v -> (OperationNode) ValueNode.create(v)).toList());
  }

  @Override public NodeKind kind() { return NodeKind.VALUE_LIST; }
}
