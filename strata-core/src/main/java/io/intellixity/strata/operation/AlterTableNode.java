package io.intellixity.strata.operation;

import java.util.List;
import java.util.Objects;

/** ALTER TABLE with one or more comma separated actions. */
public record AlterTableNode(TableNode table, List<AlterTableActionNode> actions) implements RootOperationNode {
  public AlterTableNode {
    Objects.requireNonNull(table, "table");
    actions = Nodes.copyNonEmpty(actions, "actions");
  }

  public static AlterTableNode create(TableNode table, AlterTableActionNode... actions) {
    return new AlterTableNode(table, List.of(actions));
  }

  @Override public NodeKind kind() { return NodeKind.ALTER_TABLE; }
}
