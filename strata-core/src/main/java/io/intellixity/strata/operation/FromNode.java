package io.intellixity.strata.operation;

import java.util.List;

public record FromNode(List<OperationNode> froms) implements OperationNode {
  public FromNode {
    froms = Nodes.copyNonEmpty(froms, "froms");
  }

  public static FromNode create(List<? extends OperationNode> froms) {
    return new FromNode(List.copyOf(froms));
  }

  public static FromNode create(OperationNode from) {
    return new FromNode(List.of(from));
  }

  @Override public NodeKind kind() { return NodeKind.FROM; }
}
