package io.intellixity.strata.postgres;

import io.intellixity.strata.compiler.DefaultQueryCompiler;
import io.intellixity.strata.operation.OnConflictNode;
import io.intellixity.strata.operation.OperationNode;
import io.intellixity.strata.operation.Operator;
import io.intellixity.strata.operation.ReturningNode;

import java.util.List;

/**
 * Postgres compiler.
 *
 * Keeps only Postgres-specific overrides: {@code $n} placeholders, RETURNING, ON CONFLICT,
 * DISTINCT ON and the Postgres operators. Generic rendering lives in {@link DefaultQueryCompiler}.
 */
public final class PostgresQueryCompiler extends DefaultQueryCompiler {
  @Override protected String dialectName() { return "postgres"; }

  @Override
  protected String parameterPlaceholder(int position) {
    return "$" + position;
  }

  @Override
  protected boolean supportsOperator(Operator operator) {
    return true;
  }

  @Override
  protected void visitDistinctOn(List<OperationNode> expressions, RenderCtx ctx) {
    ctx.append("DISTINCT ON (");
    visitList(expressions, ctx);
    ctx.append(")");
  }

  @Override
  protected void visitReturning(ReturningNode node, RenderCtx ctx) {
    ctx.append("RETURNING ");
    visitList(node.selections(), ctx);
  }

  @Override
  protected void visitOnConflict(OnConflictNode node, RenderCtx ctx) {
    ctx.append("ON CONFLICT");
    if (!node.columns().isEmpty()) {
      ctx.append(" (");
      visitList(node.columns(), ctx);
      ctx.append(")");
    } else if (node.constraint() != null) {
      ctx.append(" ON CONSTRAINT ");
      visitNode(node.constraint(), ctx);
    }
    if (node.doNothing()) {
      ctx.append(" DO NOTHING");
      return;
    }
    ctx.append(" DO UPDATE SET ");
    visitList(node.updates(), ctx);
    if (node.updateWhere() != null) {
      ctx.append(" ");
      visitNode(node.updateWhere(), ctx);
    }
  }
}
