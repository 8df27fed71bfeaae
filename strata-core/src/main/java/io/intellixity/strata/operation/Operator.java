package io.intellixity.strata.operation;

public enum Operator {
  EQ("=", false),
  NE("<>", false),
  GT(">", false),
  GE(">=", false),
  LT("<", false),
  LE("<=", false),

  IN("IN", false),
  NOT_IN("NOT IN", false),
  LIKE("LIKE", false),
  NOT_LIKE("NOT LIKE", false),
  IS("IS", false),
  IS_NOT("IS NOT", false),
  IS_DISTINCT_FROM("IS DISTINCT FROM", false),

  PLUS("+", false),
  MINUS("-", false),
  MULTIPLY("*", false),
  DIVIDE("/", false),
  MODULO("%", false),
  CONCAT("||", false),

  NOT("NOT", false),
  EXISTS("EXISTS", false),
  NOT_EXISTS("NOT EXISTS", false),

  // Dialect-sensitive operators: only rendered by compilers that opt in.
  ILIKE("ILIKE", true),
  NOT_ILIKE("NOT ILIKE", true),
  REGEX_MATCH("~", true),
  CONTAINS("@>", true),
  CONTAINED_BY("<@", true),
  OVERLAPS("&&", true);

  private final String sql;
  private final boolean dialectSpecific;

  Operator(String sql, boolean dialectSpecific) {
    this.sql = sql;
    this.dialectSpecific = dialectSpecific;
  }

  public String sql() {
    return sql;
  }

  public boolean isDialectSpecific() {
    return dialectSpecific;
  }
}
