package io.intellixity.strata.operation;

import java.util.List;

/**
 * Upsert clause: {@code ON CONFLICT (...) DO NOTHING | DO UPDATE SET ...}.
 *
 * @param columns conflict target columns (empty when a constraint name or no target is used)
 * @param constraint conflict target constraint, or null
 * @param updates SET list for DO UPDATE; empty means DO NOTHING
 * @param updateWhere optional WHERE for DO UPDATE
 */
public record OnConflictNode(
    List<ColumnNode> columns,
    IdentifierNode constraint,
    List<ColumnUpdateNode> updates,
    WhereNode updateWhere
) implements OperationNode {
  public OnConflictNode {
    columns = Nodes.copyOrEmpty(columns);
    updates = Nodes.copyOrEmpty(updates);
    if (!columns.isEmpty() && constraint != null) {
      throw new IllegalArgumentException("ON CONFLICT takes either columns or a constraint, not both");
    }
    if (!updates.isEmpty() && columns.isEmpty() && constraint == null) {
      throw new IllegalArgumentException("DO UPDATE requires a conflict target");
    }
    if (updates.isEmpty() && updateWhere != null) {
      throw new IllegalArgumentException("WHERE only applies to DO UPDATE");
    }
  }

  public static OnConflictNode createDoNothing(List<String> columns) {
    return new OnConflictNode(ColumnNode.createAll(columns), null, List.of(), null);
  }

  public static OnConflictNode createDoUpdate(List<String> columns, List<ColumnUpdateNode> updates) {
    return new OnConflictNode(ColumnNode.createAll(columns), null, Nodes.copyNonEmpty(updates, "updates"), null);
  }

  public static OnConflictNode createOnConstraintDoNothing(String constraint) {
    return new OnConflictNode(List.of(), IdentifierNode.create(constraint), List.of(), null);
  }

  public boolean doNothing() {
    return updates.isEmpty();
  }

  public OnConflictNode withUpdateWhere(OperationNode predicate) {
    return new OnConflictNode(columns, constraint, updates, WhereNode.create(predicate));
  }

  @Override public NodeKind kind() { return NodeKind.ON_CONFLICT; }
}
