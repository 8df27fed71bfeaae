package io.intellixity.strata.operation;

/**
 * Immutable SQL AST element.
 * <p>
 * Variants are records: structurally comparable, deeply immutable (child lists are copied on
 * construction) and validated in their canonical constructors. Use the static {@code create}
 * factories on each record.
 */
public sealed interface OperationNode
    permits RootOperationNode, ConstraintNode, AlterTableActionNode,
    IdentifierNode, SchemableIdentifierNode, TableNode, ColumnNode, ReferenceNode, SelectAllNode,
    AliasNode, ValueNode, ValueListNode, OperatorNode, BinaryOperationNode, UnaryOperationNode,
    AndNode, OrNode, ParensNode, FunctionNode,
    SelectionNode, FromNode, JoinNode, OnNode, WhereNode, GroupByNode, GroupByItemNode, HavingNode,
    OrderByNode, OrderByItemNode, LimitNode, OffsetNode,
    ValuesNode, ColumnUpdateNode, ReturningNode, OnConflictNode,
    DataTypeNode, ColumnDefinitionNode {

  NodeKind kind();
}
