package io.intellixity.strata.operation;

import java.util.List;

public record ValuesNode(List<ValueListNode> values) implements OperationNode {
  public ValuesNode {
    values = Nodes.copyNonEmpty(values, "values");
    int width = values.get(0).values().size();
    for (ValueListNode row : values) {
      if (row.values().size() != width) {
        throw new IllegalArgumentException("All VALUES rows must have " + width + " entries");
      }
    }
  }

  public static ValuesNode create(List<ValueListNode> values) {
    return new ValuesNode(values);
  }

  @Override public NodeKind kind() { return NodeKind.VALUES; }
}
