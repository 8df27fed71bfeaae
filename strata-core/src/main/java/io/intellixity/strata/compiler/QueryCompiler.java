package io.intellixity.strata.compiler;

import io.intellixity.strata.operation.RootOperationNode;

/**
 * Turns a statement AST into dialect-specific SQL.
 * <p>
 * Implementations are stateless between calls: the same tree always yields the same SQL and
 * parameters, and a compiler may be shared across threads.
 */
public interface QueryCompiler {
  /**
   * @throws io.intellixity.strata.error.UnsupportedNodeException if the tree contains a node
   *     kind or operator this dialect cannot render
   */
  CompiledQuery compileQuery(RootOperationNode node);
}
