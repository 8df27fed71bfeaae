package io.intellixity.strata.operation;

import java.util.Objects;

/**
 * Column reference, optionally table-qualified.
 *
 * @param table qualifying table, or null
 * @param column a {@link ColumnNode} or a {@link SelectAllNode}
 */
public record ReferenceNode(TableNode table, OperationNode column) implements OperationNode {
  public ReferenceNode {
    Objects.requireNonNull(column, "column");
    if (!(column instanceof ColumnNode) && !(column instanceof SelectAllNode)) {
      throw new IllegalArgumentException("Reference column must be a column or select-all node, got: " + column.kind().label());
    }
  }

  public static ReferenceNode create(String column) {
    return new ReferenceNode(null, ColumnNode.create(column));
  }

  public static ReferenceNode create(String table, String column) {
    return new ReferenceNode(TableNode.create(table), ColumnNode.create(column));
  }

  public static ReferenceNode createSelectAll(String table) {
    return new ReferenceNode(TableNode.create(table), SelectAllNode.create());
  }

  @Override public NodeKind kind() { return NodeKind.REFERENCE; }
}
