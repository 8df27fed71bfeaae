package io.intellixity.strata.operation;

/**
 * A value. Rendered as a bound parameter, or inlined as a literal when {@code immediate}
 * (DDL defaults, where parameters are not accepted).
 *
 * @param value the value; null means SQL NULL
 */
public record ValueNode(Object value, boolean immediate) implements OperationNode {
  public static ValueNode create(Object value) {
    return new ValueNode(value, false);
  }

  public static ValueNode createImmediate(Object value) {
    return new ValueNode(value, true);
  }

  @Override public NodeKind kind() { return NodeKind.VALUE; }
}
