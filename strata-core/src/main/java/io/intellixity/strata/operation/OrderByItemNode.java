package io.intellixity.strata.operation;

import java.util.Objects;

/**
 * @param direction sort direction, or null to leave it to the database default
 */
public record OrderByItemNode(OperationNode orderBy, Direction direction) implements OperationNode {
  public enum Direction { ASC, DESC }

  public OrderByItemNode {
    Objects.requireNonNull(orderBy, "orderBy");
  }

  public static OrderByItemNode create(OperationNode orderBy) {
    return new OrderByItemNode(orderBy, null);
  }

  public static OrderByItemNode create(OperationNode orderBy, Direction direction) {
    return new OrderByItemNode(orderBy, direction);
  }

  @Override public NodeKind kind() { return NodeKind.ORDER_BY_ITEM; }
}
