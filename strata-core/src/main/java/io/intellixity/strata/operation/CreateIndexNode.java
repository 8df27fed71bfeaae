package io.intellixity.strata.operation;

import java.util.List;
import java.util.Objects;

public record CreateIndexNode(
    IdentifierNode name,
    TableNode table,
    List<ColumnNode> columns,
    boolean unique,
    boolean ifNotExists
) implements RootOperationNode {
  public CreateIndexNode {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(table, "table");
    columns = Nodes.copyNonEmpty(columns, "columns");
  }

  public static CreateIndexNode create(String name, TableNode table, List<String> columns) {
    return new CreateIndexNode(IdentifierNode.create(name), table, ColumnNode.createAll(columns), false, false);
  }

  public CreateIndexNode withUnique() {
    return new CreateIndexNode(name, table, columns, true, ifNotExists);
  }

  public CreateIndexNode withIfNotExists() {
    return new CreateIndexNode(name, table, columns, unique, true);
  }

  @Override public NodeKind kind() { return NodeKind.CREATE_INDEX; }
}
