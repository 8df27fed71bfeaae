package io.intellixity.strata.operation;

public sealed interface AlterTableActionNode extends OperationNode
    permits AddColumnNode, DropColumnNode, AddConstraintNode, DropConstraintNode {
}
