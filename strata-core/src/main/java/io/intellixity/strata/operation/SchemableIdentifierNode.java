package io.intellixity.strata.operation;

import java.util.Objects;

/** Identifier optionally qualified by a schema: {@code "schema"."name"}. */
public record SchemableIdentifierNode(IdentifierNode schema, IdentifierNode identifier) implements OperationNode {
  public SchemableIdentifierNode {
    Objects.requireNonNull(identifier, "identifier");
  }

  public static SchemableIdentifierNode create(String identifier) {
    return new SchemableIdentifierNode(null, IdentifierNode.create(identifier));
  }

  public static SchemableIdentifierNode createWithSchema(String schema, String identifier) {
    return new SchemableIdentifierNode(IdentifierNode.create(schema), IdentifierNode.create(identifier));
  }

  @Override public NodeKind kind() { return NodeKind.SCHEMABLE_IDENTIFIER; }
}
