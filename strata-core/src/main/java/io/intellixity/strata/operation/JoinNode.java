package io.intellixity.strata.operation;

import java.util.Objects;

public record JoinNode(JoinType joinType, OperationNode table, OnNode on) implements OperationNode {
  public enum JoinType {
    INNER("INNER JOIN"),
    LEFT("LEFT JOIN"),
    RIGHT("RIGHT JOIN"),
    FULL("FULL JOIN"),
    CROSS("CROSS JOIN");

    private final String sql;

    JoinType(String sql) {
      this.sql = sql;
    }

    public String sql() {
      return sql;
    }
  }

  public JoinNode {
    Objects.requireNonNull(joinType, "joinType");
    Objects.requireNonNull(table, "table");
    if (joinType == JoinType.CROSS && on != null) throw new IllegalArgumentException("CROSS JOIN takes no ON clause");
    if (joinType != JoinType.CROSS && on == null) throw new IllegalArgumentException(joinType.sql() + " requires an ON clause");
  }

  public static JoinNode create(JoinType joinType, OperationNode table, OperationNode on) {
    return new JoinNode(joinType, table, on == null ? null : OnNode.create(on));
  }

  public static JoinNode createCross(OperationNode table) {
    return new JoinNode(JoinType.CROSS, table, null);
  }

  @Override public NodeKind kind() { return NodeKind.JOIN; }
}
