package io.intellixity.strata.operation;

/** Table constraint, usable inside CREATE TABLE or ALTER TABLE ... ADD. */
public sealed interface ConstraintNode extends OperationNode
    permits PrimaryKeyConstraintNode, UniqueConstraintNode, ForeignKeyConstraintNode, CheckConstraintNode {

  /** Optional constraint name; null renders an anonymous constraint. */
  IdentifierNode name();
}
