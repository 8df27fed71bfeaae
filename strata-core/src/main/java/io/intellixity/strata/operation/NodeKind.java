package io.intellixity.strata.operation;

/**
 * Discriminator for every {@link OperationNode} variant.
 * <p>
 * The set is closed: compilers switch over it and must reject kinds they cannot render.
 */
public enum NodeKind {
  IDENTIFIER("identifier"),
  SCHEMABLE_IDENTIFIER("schemable-identifier"),
  TABLE("table"),
  COLUMN("column"),
  REFERENCE("reference"),
  SELECT_ALL("select-all"),
  ALIAS("alias"),
  VALUE("value"),
  VALUE_LIST("value-list"),
  RAW("raw"),
  OPERATOR("operator"),
  BINARY_OPERATION("binary-operation"),
  UNARY_OPERATION("unary-operation"),
  AND("and"),
  OR("or"),
  PARENS("parens"),
  FUNCTION("function"),

  SELECTION("selection"),
  FROM("from"),
  JOIN("join"),
  ON("on"),
  WHERE("where"),
  GROUP_BY("group-by"),
  GROUP_BY_ITEM("group-by-item"),
  HAVING("having"),
  ORDER_BY("order-by"),
  ORDER_BY_ITEM("order-by-item"),
  LIMIT("limit"),
  OFFSET("offset"),
  SELECT_QUERY("select-query"),

  VALUES("values"),
  INSERT_QUERY("insert-query"),
  COLUMN_UPDATE("column-update"),
  UPDATE_QUERY("update-query"),
  DELETE_QUERY("delete-query"),
  RETURNING("returning"),
  ON_CONFLICT("on-conflict"),

  DATA_TYPE("data-type"),
  COLUMN_DEFINITION("column-definition"),
  PRIMARY_KEY_CONSTRAINT("primary-key-constraint"),
  UNIQUE_CONSTRAINT("unique-constraint"),
  FOREIGN_KEY_CONSTRAINT("foreign-key-constraint"),
  CHECK_CONSTRAINT("check-constraint"),
  CREATE_TABLE("create-table"),
  DROP_TABLE("drop-table"),
  ALTER_TABLE("alter-table"),
  ADD_COLUMN("add-column"),
  DROP_COLUMN("drop-column"),
  ADD_CONSTRAINT("add-constraint"),
  DROP_CONSTRAINT("drop-constraint"),
  CREATE_INDEX("create-index"),
  DROP_INDEX("drop-index");

  private final String label;

  NodeKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** Type guard: true if {@code node} is non-null and of this kind. */
  public boolean is(OperationNode node) {
    return node != null && node.kind() == this;
  }
}
