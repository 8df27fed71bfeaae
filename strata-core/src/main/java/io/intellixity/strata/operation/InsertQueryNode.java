package io.intellixity.strata.operation;

import java.util.List;
import java.util.Objects;

/**
 * @param values a {@link ValuesNode}, a {@link SelectQueryNode}, or null for DEFAULT VALUES
 */
public record InsertQueryNode(
    TableNode into,
    List<ColumnNode> columns,
    OperationNode values,
    OnConflictNode onConflict,
    ReturningNode returning
) implements RootOperationNode {
  public InsertQueryNode {
    Objects.requireNonNull(into, "into");
    columns = Nodes.copyOrEmpty(columns);
    if (values != null && !(values instanceof ValuesNode) && !(values instanceof SelectQueryNode)) {
      throw new IllegalArgumentException("Insert values must be a values or select-query node, got: " + values.kind().label());
    }
    if (values instanceof ValuesNode v && !columns.isEmpty()
        && v.values().get(0).values().size() != columns.size()) {
      throw new IllegalArgumentException("VALUES width does not match the column list (" + columns.size() + ")");
    }
  }

  public static InsertQueryNode create(TableNode into, List<ColumnNode> columns, OperationNode values) {
    return new InsertQueryNode(into, columns, values, null, null);
  }

  public static InsertQueryNode createDefaultValues(TableNode into) {
    return new InsertQueryNode(into, List.of(), null, null, null);
  }

  public InsertQueryNode withOnConflict(OnConflictNode c) {
    return new InsertQueryNode(into, columns, values, c, returning);
  }

  public InsertQueryNode withReturning(ReturningNode r) {
    return new InsertQueryNode(into, columns, values, onConflict, r);
  }

  @Override public NodeKind kind() { return NodeKind.INSERT_QUERY; }
}
