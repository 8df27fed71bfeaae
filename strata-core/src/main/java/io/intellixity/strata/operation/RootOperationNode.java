package io.intellixity.strata.operation;

/** A node that can be compiled on its own into an executable statement. */
public sealed interface RootOperationNode extends OperationNode
    permits SelectQueryNode, InsertQueryNode, UpdateQueryNode, DeleteQueryNode,
    CreateTableNode, DropTableNode, AlterTableNode, CreateIndexNode, DropIndexNode, RawNode {
}
