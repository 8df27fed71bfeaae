package io.intellixity.strata.operation;

import java.util.Objects;

public record TableNode(SchemableIdentifierNode table) implements OperationNode {
  public TableNode {
    Objects.requireNonNull(table, "table");
  }

  public static TableNode create(String table) {
    return new TableNode(SchemableIdentifierNode.create(table));
  }

  public static TableNode createWithSchema(String schema, String table) {
    return new TableNode(SchemableIdentifierNode.createWithSchema(schema, table));
  }

  @Override public NodeKind kind() { return NodeKind.TABLE; }
}
