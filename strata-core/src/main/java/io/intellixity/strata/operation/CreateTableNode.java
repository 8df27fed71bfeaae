package io.intellixity.strata.operation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record CreateTableNode(
    TableNode table,
    boolean temporary,
    boolean ifNotExists,
    List<ColumnDefinitionNode> columns,
    List<ConstraintNode> constraints
) implements RootOperationNode {
  public CreateTableNode {
    Objects.requireNonNull(table, "table");
    columns = Nodes.copyOrEmpty(columns);
    constraints = Nodes.copyOrEmpty(constraints);
  }

  public static CreateTableNode create(TableNode table) {
    return new CreateTableNode(table, false, false, List.of(), List.of());
  }

  public CreateTableNode withTemporary() {
    return new CreateTableNode(table, true, ifNotExists, columns, constraints);
  }

  public CreateTableNode withIfNotExists() {
    return new CreateTableNode(table, temporary, true, columns, constraints);
  }

  public CreateTableNode withColumn(ColumnDefinitionNode column) {
    List<ColumnDefinitionNode> all = new ArrayList<>(columns);
    all.add(column);
    return new CreateTableNode(table, temporary, ifNotExists, all, constraints);
  }

  public CreateTableNode withConstraint(ConstraintNode constraint) {
    List<ConstraintNode> all = new ArrayList<>(constraints);
    all.add(constraint);
    return new CreateTableNode(table, temporary, ifNotExists, columns, all);
  }

  @Override public NodeKind kind() { return NodeKind.CREATE_TABLE; }
}
