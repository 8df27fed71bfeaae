package io.intellixity.strata.operation;

import java.util.List;
import java.util.Objects;

/**
 * {@code FOREIGN KEY (cols) REFERENCES table (cols) [ON DELETE ..] [ON UPDATE ..]}.
 *
 * @param onDelete action, or null for the database default
 * @param onUpdate action, or null for the database default
 */
public record ForeignKeyConstraintNode(
    List<ColumnNode> columns,
    TableNode references,
    List<ColumnNode> referencedColumns,
    IdentifierNode name,
    ReferentialAction onDelete,
    ReferentialAction onUpdate
) implements ConstraintNode {
  public enum ReferentialAction {
    CASCADE("CASCADE"),
    SET_NULL("SET NULL"),
    SET_DEFAULT("SET DEFAULT"),
    RESTRICT("RESTRICT"),
    NO_ACTION("NO ACTION");

    private final String sql;

    ReferentialAction(String sql) {
      this.sql = sql;
    }

    public String sql() {
      return sql;
    }
  }

  public ForeignKeyConstraintNode {
    columns = Nodes.copyNonEmpty(columns, "columns");
    Objects.requireNonNull(references, "references");
    referencedColumns = Nodes.copyNonEmpty(referencedColumns, "referencedColumns");
    if (columns.size() != referencedColumns.size()) {
      throw new IllegalArgumentException("Foreign key column count " + columns.size()
          + " does not match referenced column count " + referencedColumns.size());
    }
  }

  public static ForeignKeyConstraintNode create(List<String> columns, TableNode references, List<String> referencedColumns) {
    return new ForeignKeyConstraintNode(ColumnNode.createAll(columns), references, ColumnNode.createAll(referencedColumns),
        null, null, null);
  }

  public ForeignKeyConstraintNode withName(String n) {
    return new ForeignKeyConstraintNode(columns, references, referencedColumns, IdentifierNode.create(n), onDelete, onUpdate);
  }

  public ForeignKeyConstraintNode withOnDelete(ReferentialAction action) {
    return new ForeignKeyConstraintNode(columns, references, referencedColumns, name, action, onUpdate);
  }

  public ForeignKeyConstraintNode withOnUpdate(ReferentialAction action) {
    return new ForeignKeyConstraintNode(columns, references, referencedColumns, name, onDelete, action);
  }

  @Override public NodeKind kind() { return NodeKind.FOREIGN_KEY_CONSTRAINT; }
}
