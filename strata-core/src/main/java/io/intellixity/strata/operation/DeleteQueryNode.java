package io.intellixity.strata.operation;

import java.util.Objects;

public record DeleteQueryNode(TableNode from, WhereNode where, ReturningNode returning) implements RootOperationNode {
  public DeleteQueryNode {
    Objects.requireNonNull(from, "from");
  }

  public static DeleteQueryNode create(TableNode from) {
    return new DeleteQueryNode(from, null, null);
  }

  public DeleteQueryNode withWhere(OperationNode predicate) {
    WhereNode w = (where == null) ? WhereNode.create(predicate) : where.cloneWithAnd(predicate);
    return new DeleteQueryNode(from, w, returning);
  }

  public DeleteQueryNode withReturning(ReturningNode r) {
    return new DeleteQueryNode(from, where, r);
  }

  @Override public NodeKind kind() { return NodeKind.DELETE_QUERY; }
}
