package io.intellixity.strata.operation;

import java.util.ArrayList;
import java.util.List;

/**
 * SELECT statement (or subquery).
 *
 * @param from FROM clause, or null for {@code SELECT 1}-style queries
 * @param distinctOn expressions for Postgres {@code DISTINCT ON (...)}; empty when unused
 */
public record SelectQueryNode(
    FromNode from,
    List<SelectionNode> selections,
    List<JoinNode> joins,
    boolean distinct,
    List<OperationNode> distinctOn,
    WhereNode where,
    GroupByNode groupBy,
    HavingNode having,
    OrderByNode orderBy,
    LimitNode limit,
    OffsetNode offset
) implements RootOperationNode {
  public SelectQueryNode {
    selections = Nodes.copyOrEmpty(selections);
    joins = Nodes.copyOrEmpty(joins);
    distinctOn = Nodes.copyOrEmpty(distinctOn);
    if (distinct && !distinctOn.isEmpty()) {
      throw new IllegalArgumentException("DISTINCT and DISTINCT ON are mutually exclusive");
    }
    if (from == null && !joins.isEmpty()) throw new IllegalArgumentException("JOIN requires a FROM clause");
  }

  public static SelectQueryNode create(FromNode from) {
    return new SelectQueryNode(from, List.of(), List.of(), false, List.of(), null, null, null, null, null, null);
  }

  public static SelectQueryNode createFrom(TableNode table) {
    return create(FromNode.create(table));
  }

  public SelectQueryNode withSelections(List<SelectionNode> more) {
    List<SelectionNode> all = new ArrayList<>(selections);
    all.addAll(more);
    return new SelectQueryNode(from, all, joins, distinct, distinctOn, where, groupBy, having, orderBy, limit, offset);
  }

  public SelectQueryNode withJoin(JoinNode join) {
    List<JoinNode> all = new ArrayList<>(joins);
    all.add(join);
    return new SelectQueryNode(from, selections, all, distinct, distinctOn, where, groupBy, having, orderBy, limit, offset);
  }

  public SelectQueryNode withDistinct() {
    return new SelectQueryNode(from, selections, joins, true, List.of(), where, groupBy, having, orderBy, limit, offset);
  }

  public SelectQueryNode withDistinctOn(List<? extends OperationNode> expressions) {
    return new SelectQueryNode(from, selections, joins, false, List.copyOf(expressions), where, groupBy, having, orderBy, limit, offset);
  }

  /** Sets the WHERE clause, or ANDs the predicate onto the existing one. */
  public SelectQueryNode withWhere(OperationNode predicate) {
    WhereNode w = (where == null) ? WhereNode.create(predicate) : where.cloneWithAnd(predicate);
    return new SelectQueryNode(from, selections, joins, distinct, distinctOn, w, groupBy, having, orderBy, limit, offset);
  }

  public SelectQueryNode withGroupBy(GroupByNode g) {
    return new SelectQueryNode(from, selections, joins, distinct, distinctOn, where, g, having, orderBy, limit, offset);
  }

  public SelectQueryNode withHaving(HavingNode h) {
    return new SelectQueryNode(from, selections, joins, distinct, distinctOn, where, groupBy, h, orderBy, limit, offset);
  }

  public SelectQueryNode withOrderBy(OrderByNode o) {
    return new SelectQueryNode(from, selections, joins, distinct, distinctOn, where, groupBy, having, o, limit, offset);
  }

  public SelectQueryNode withLimit(LimitNode l) {
    return new SelectQueryNode(from, selections, joins, distinct, distinctOn, where, groupBy, having, orderBy, l, offset);
  }

  public SelectQueryNode withOffset(OffsetNode o) {
    return new SelectQueryNode(from, selections, joins, distinct, distinctOn, where, groupBy, having, orderBy, limit, o);
  }

  @Override public NodeKind kind() { return NodeKind.SELECT_QUERY; }
}
