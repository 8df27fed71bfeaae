package io.intellixity.strata.operation;

/** The {@code *} in {@code SELECT *} or {@code "t".*}. */
public record SelectAllNode() implements OperationNode {
  public static SelectAllNode create() {
    return new SelectAllNode();
  }

  @Override public NodeKind kind() { return NodeKind.SELECT_ALL; }
}
