package io.intellixity.strata.operation;

import java.util.List;
import java.util.Objects;

public record UpdateQueryNode(
    TableNode table,
    List<ColumnUpdateNode> updates,
    FromNode from,
    WhereNode where,
    ReturningNode returning
) implements RootOperationNode {
  public UpdateQueryNode {
    Objects.requireNonNull(table, "table");
    updates = Nodes.copyNonEmpty(updates, "updates");
  }

  public static UpdateQueryNode create(TableNode table, List<ColumnUpdateNode> updates) {
    return new UpdateQueryNode(table, updates, null, null, null);
  }

  public UpdateQueryNode withFrom(FromNode f) {
    return new UpdateQueryNode(table, updates, f, where, returning);
  }

  public UpdateQueryNode withWhere(OperationNode predicate) {
    WhereNode w = (where == null) ? WhereNode.create(predicate) : where.cloneWithAnd(predicate);
    return new UpdateQueryNode(table, updates, from, w, returning);
  }

  public UpdateQueryNode withReturning(ReturningNode r) {
    return new UpdateQueryNode(table, updates, from, where, r);
  }

  @Override public NodeKind kind() { return NodeKind.UPDATE_QUERY; }
}
