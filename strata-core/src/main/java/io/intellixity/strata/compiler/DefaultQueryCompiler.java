package io.intellixity.strata.compiler;

import io.intellixity.strata.error.UnsupportedNodeException;
import io.intellixity.strata.operation.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dialect-neutral SQL compiler.
 *
 * Renders every node kind with ANSI-ish syntax: {@code "} quoted identifiers, {@code ?}
 * placeholders, uppercase keywords.
 *
 * Dialects extend this class and override hooks for quoting, placeholders, and the
 * constructs that only some databases have (RETURNING, ON CONFLICT, DISTINCT ON and
 * dialect-specific operators). The defaults for those throw {@link UnsupportedNodeException}.
 */
public class DefaultQueryCompiler implements QueryCompiler {
  protected static final class RenderCtx {
    private final StringBuilder sql = new StringBuilder();
    private final List<Object> parameters = new ArrayList<>();
    private int queryDepth;

    public RenderCtx append(String s) {
      sql.append(s);
      return this;
    }

    /** Records the parameter and returns its 1-based position. */
    public int addParameter(Object value) {
      parameters.add(value);
      return parameters.size();
    }

    public int queryDepth() {
      return queryDepth;
    }
  }

  @Override
  public final CompiledQuery compileQuery(RootOperationNode node) {
    Objects.requireNonNull(node, "node");
    RenderCtx ctx = new RenderCtx();
    visitNode(node, ctx);
    return new CompiledQuery(ctx.sql.toString(), ctx.parameters, node);
  }

  /** Name used in {@link UnsupportedNodeException} messages. */
  protected String dialectName() {
    return "default";
  }

  protected String quoteIdentifier(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  /** Placeholder for the parameter at 1-based {@code position}. */
  protected String parameterPlaceholder(int position) {
    return "?";
  }

  protected boolean supportsOperator(Operator operator) {
    return !operator.isDialectSpecific();
  }

  /** Inlines a literal; used for immediate values, which DDL needs since it takes no parameters. */
  protected void appendImmediateValue(Object value, RenderCtx ctx) {
    if (value == null) {
      ctx.append("NULL");
    } else if (value instanceof Boolean b) {
      ctx.append(b ? "TRUE" : "FALSE");
    } else if (value instanceof BigDecimal bd) {
      ctx.append(bd.toPlainString());
    } else if (value instanceof Number n) {
      ctx.append(n.toString());
    } else if (value instanceof String s) {
      ctx.append("'").append(s.replace("'", "''")).append("'");
    } else {
      throw new IllegalArgumentException("Cannot inline value of type " + value.getClass().getName());
    }
  }

  protected final void visitNode(OperationNode node, RenderCtx ctx) {
    Objects.requireNonNull(node, "node");
    switch (node.kind()) {
      case IDENTIFIER -> visitIdentifier((IdentifierNode) node, ctx);
      case SCHEMABLE_IDENTIFIER -> visitSchemableIdentifier((SchemableIdentifierNode) node, ctx);
      case TABLE -> visitNode(((TableNode) node).table(), ctx);
      case COLUMN -> visitNode(((ColumnNode) node).column(), ctx);
      case REFERENCE -> visitReference((ReferenceNode) node, ctx);
      case SELECT_ALL -> ctx.append("*");
      case ALIAS -> visitAlias((AliasNode) node, ctx);
      case VALUE -> visitValue((ValueNode) node, ctx);
      case VALUE_LIST -> visitValueList((ValueListNode) node, ctx);
      case RAW -> visitRaw((RawNode) node, ctx);
      case OPERATOR -> visitOperator((OperatorNode) node, ctx);
      case BINARY_OPERATION -> visitBinaryOperation((BinaryOperationNode) node, ctx);
      case UNARY_OPERATION -> visitUnaryOperation((UnaryOperationNode) node, ctx);
      case AND -> visitLogical(((AndNode) node).left(), "AND", ((AndNode) node).right(), ctx);
      case OR -> visitLogical(((OrNode) node).left(), "OR", ((OrNode) node).right(), ctx);
      case PARENS -> {
        ctx.append("(");
        visitNode(((ParensNode) node).node(), ctx);
        ctx.append(")");
      }
      case FUNCTION -> visitFunction((FunctionNode) node, ctx);
      case SELECTION -> visitNode(((SelectionNode) node).selection(), ctx);
      case FROM -> visitFrom((FromNode) node, ctx);
      case JOIN -> visitJoin((JoinNode) node, ctx);
      case ON -> visitClause("ON ", ((OnNode) node).on(), ctx);
      case WHERE -> visitClause("WHERE ", ((WhereNode) node).where(), ctx);
      case GROUP_BY -> {
        ctx.append("GROUP BY ");
        visitList(((GroupByNode) node).items(), ctx);
      }
      case GROUP_BY_ITEM -> visitNode(((GroupByItemNode) node).groupBy(), ctx);
      case HAVING -> visitClause("HAVING ", ((HavingNode) node).having(), ctx);
      case ORDER_BY -> {
        ctx.append("ORDER BY ");
        visitList(((OrderByNode) node).items(), ctx);
      }
      case ORDER_BY_ITEM -> visitOrderByItem((OrderByItemNode) node, ctx);
      case LIMIT -> visitClause("LIMIT ", ((LimitNode) node).limit(), ctx);
      case OFFSET -> visitClause("OFFSET ", ((OffsetNode) node).offset(), ctx);
      case SELECT_QUERY -> visitSelectQuery((SelectQueryNode) node, ctx);
      case VALUES -> visitValues((ValuesNode) node, ctx);
      case INSERT_QUERY -> visitInsertQuery((InsertQueryNode) node, ctx);
      case COLUMN_UPDATE -> visitColumnUpdate((ColumnUpdateNode) node, ctx);
      case UPDATE_QUERY -> visitUpdateQuery((UpdateQueryNode) node, ctx);
      case DELETE_QUERY -> visitDeleteQuery((DeleteQueryNode) node, ctx);
      case RETURNING -> visitReturning((ReturningNode) node, ctx);
      case ON_CONFLICT -> visitOnConflict((OnConflictNode) node, ctx);
      case DATA_TYPE -> ctx.append(((DataTypeNode) node).dataType());
      case COLUMN_DEFINITION -> visitColumnDefinition((ColumnDefinitionNode) node, ctx);
      case PRIMARY_KEY_CONSTRAINT, UNIQUE_CONSTRAINT, FOREIGN_KEY_CONSTRAINT, CHECK_CONSTRAINT ->
          visitConstraint((ConstraintNode) node, ctx);
      case CREATE_TABLE -> visitCreateTable((CreateTableNode) node, ctx);
      case DROP_TABLE -> visitDropTable((DropTableNode) node, ctx);
      case ALTER_TABLE -> visitAlterTable((AlterTableNode) node, ctx);
      case ADD_COLUMN -> {
        ctx.append("ADD COLUMN ");
        visitNode(((AddColumnNode) node).column(), ctx);
      }
      case DROP_COLUMN -> {
        ctx.append("DROP COLUMN ");
        visitNode(((DropColumnNode) node).column(), ctx);
      }
      case ADD_CONSTRAINT -> {
        ctx.append("ADD ");
        visitNode(((AddConstraintNode) node).constraint(), ctx);
      }
      case DROP_CONSTRAINT -> {
        ctx.append("DROP CONSTRAINT ");
        visitNode(((DropConstraintNode) node).constraintName(), ctx);
      }
      case CREATE_INDEX -> visitCreateIndex((CreateIndexNode) node, ctx);
      case DROP_INDEX -> visitDropIndex((DropIndexNode) node, ctx);
      default -> throw new UnsupportedNodeException(node.kind(), dialectName());
    }
  }

  protected void visitIdentifier(IdentifierNode node, RenderCtx ctx) {
    ctx.append(quoteIdentifier(node.name()));
  }

  protected void visitSchemableIdentifier(SchemableIdentifierNode node, RenderCtx ctx) {
    if (node.schema() != null) {
      visitNode(node.schema(), ctx);
      ctx.append(".");
    }
    visitNode(node.identifier(), ctx);
  }

  protected void visitReference(ReferenceNode node, RenderCtx ctx) {
    if (node.table() != null) {
      visitNode(node.table(), ctx);
      ctx.append(".");
    }
    visitNode(node.column(), ctx);
  }

  protected void visitAlias(AliasNode node, RenderCtx ctx) {
    visitNode(node.node(), ctx);
    ctx.append(" AS ");
    visitNode(node.alias(), ctx);
  }

  protected void visitValue(ValueNode node, RenderCtx ctx) {
    if (node.immediate()) {
      appendImmediateValue(node.value(), ctx);
    } else {
      ctx.append(parameterPlaceholder(ctx.addParameter(node.value())));
    }
  }

  protected void visitValueList(ValueListNode node, RenderCtx ctx) {
    ctx.append("(");
    visitList(node.values(), ctx);
    ctx.append(")");
  }

  protected void visitRaw(RawNode node, RenderCtx ctx) {
    List<String> fragments = node.sqlFragments();
    for (int i = 0; i < fragments.size(); i++) {
      ctx.append(fragments.get(i));
      if (i < node.parameters().size()) visitNode(node.parameters().get(i), ctx);
    }
  }

  protected void visitOperator(OperatorNode node, RenderCtx ctx) {
    Operator op = node.operator();
    if (!supportsOperator(op)) throw new UnsupportedNodeException(NodeKind.OPERATOR, dialectName(), op.sql());
    ctx.append(op.sql());
  }

  protected void visitBinaryOperation(BinaryOperationNode node, RenderCtx ctx) {
    visitNode(node.left(), ctx);
    ctx.append(" ");
    visitNode(node.operator(), ctx);
    ctx.append(" ");
    visitNode(node.right(), ctx);
  }

  protected void visitUnaryOperation(UnaryOperationNode node, RenderCtx ctx) {
    visitNode(node.operator(), ctx);
    // "-x" reads as negation; keyword operators need a separator.
    if (node.operator().operator() != Operator.MINUS) ctx.append(" ");
    visitNode(node.operand(), ctx);
  }

  protected void visitLogical(OperationNode left, String keyword, OperationNode right, RenderCtx ctx) {
    visitLogicalOperand(left, keyword, ctx);
    ctx.append(" ").append(keyword).append(" ");
    visitLogicalOperand(right, keyword, ctx);
  }

  private void visitLogicalOperand(OperationNode operand, String keyword, RenderCtx ctx) {
    // OR binds looser than AND.
    boolean wrap = "AND".equals(keyword) && operand.kind() == NodeKind.OR;
    if (wrap) ctx.append("(");
    visitNode(operand, ctx);
    if (wrap) ctx.append(")");
  }

  protected void visitFunction(FunctionNode node, RenderCtx ctx) {
    ctx.append(node.name()).append("(");
    visitList(node.arguments(), ctx);
    ctx.append(")");
  }

  protected void visitFrom(FromNode node, RenderCtx ctx) {
    ctx.append("FROM ");
    visitList(node.froms(), ctx);
  }

  protected void visitJoin(JoinNode node, RenderCtx ctx) {
    ctx.append(node.joinType().sql()).append(" ");
    visitNode(node.table(), ctx);
    if (node.on() != null) {
      ctx.append(" ");
      visitNode(node.on(), ctx);
    }
  }

  protected void visitOrderByItem(OrderByItemNode node, RenderCtx ctx) {
    visitNode(node.orderBy(), ctx);
    if (node.direction() != null) ctx.append(" ").append(node.direction().name());
  }

  protected void visitSelectQuery(SelectQueryNode node, RenderCtx ctx) {
    boolean nested = ctx.queryDepth > 0;
    if (nested) ctx.append("(");
    ctx.queryDepth++;
    try {
      ctx.append("SELECT ");
      if (node.distinct()) {
        ctx.append("DISTINCT ");
      } else if (!node.distinctOn().isEmpty()) {
        visitDistinctOn(node.distinctOn(), ctx);
        ctx.append(" ");
      }
      if (node.selections().isEmpty()) {
        ctx.append("*");
      } else {
        visitList(node.selections(), ctx);
      }
      appendOptional(node.from(), ctx);
      for (JoinNode join : node.joins()) appendOptional(join, ctx);
      appendOptional(node.where(), ctx);
      appendOptional(node.groupBy(), ctx);
      appendOptional(node.having(), ctx);
      appendOptional(node.orderBy(), ctx);
      appendOptional(node.limit(), ctx);
      appendOptional(node.offset(), ctx);
    } finally {
      ctx.queryDepth--;
    }
    if (nested) ctx.append(")");
  }

  protected void visitDistinctOn(List<OperationNode> expressions, RenderCtx ctx) {
    throw new UnsupportedNodeException(NodeKind.SELECT_QUERY, dialectName(), "DISTINCT ON");
  }

  protected void visitValues(ValuesNode node, RenderCtx ctx) {
    ctx.append("VALUES ");
    visitList(node.values(), ctx);
  }

  protected void visitInsertQuery(InsertQueryNode node, RenderCtx ctx) {
    ctx.queryDepth++;
    try {
      ctx.append("INSERT INTO ");
      visitNode(node.into(), ctx);
      if (!node.columns().isEmpty()) {
        ctx.append(" (");
        visitList(node.columns(), ctx);
        ctx.append(")");
      }
      if (node.values() == null) {
        ctx.append(" DEFAULT VALUES");
      } else {
        ctx.append(" ");
        // A source SELECT is not parenthesized.
        int depth = ctx.queryDepth;
        ctx.queryDepth = 0;
        try {
          visitNode(node.values(), ctx);
        } finally {
          ctx.queryDepth = depth;
        }
      }
      appendOptional(node.onConflict(), ctx);
      appendOptional(node.returning(), ctx);
    } finally {
      ctx.queryDepth--;
    }
  }

  protected void visitColumnUpdate(ColumnUpdateNode node, RenderCtx ctx) {
    visitNode(node.column(), ctx);
    ctx.append(" = ");
    visitNode(node.value(), ctx);
  }

  protected void visitUpdateQuery(UpdateQueryNode node, RenderCtx ctx) {
    ctx.queryDepth++;
    try {
      ctx.append("UPDATE ");
      visitNode(node.table(), ctx);
      ctx.append(" SET ");
      visitList(node.updates(), ctx);
      appendOptional(node.from(), ctx);
      appendOptional(node.where(), ctx);
      appendOptional(node.returning(), ctx);
    } finally {
      ctx.queryDepth--;
    }
  }

  protected void visitDeleteQuery(DeleteQueryNode node, RenderCtx ctx) {
    ctx.queryDepth++;
    try {
      ctx.append("DELETE FROM ");
      visitNode(node.from(), ctx);
      appendOptional(node.where(), ctx);
      appendOptional(node.returning(), ctx);
    } finally {
      ctx.queryDepth--;
    }
  }

  protected void visitReturning(ReturningNode node, RenderCtx ctx) {
    throw new UnsupportedNodeException(node.kind(), dialectName(), "RETURNING");
  }

  protected void visitOnConflict(OnConflictNode node, RenderCtx ctx) {
    throw new UnsupportedNodeException(node.kind(), dialectName(), "ON CONFLICT");
  }

  protected void visitColumnDefinition(ColumnDefinitionNode node, RenderCtx ctx) {
    visitNode(node.column(), ctx);
    ctx.append(" ");
    visitNode(node.dataType(), ctx);
    if (node.primaryKey()) ctx.append(" PRIMARY KEY");
    if (node.notNull()) ctx.append(" NOT NULL");
    if (node.unique()) ctx.append(" UNIQUE");
    if (node.defaultTo() != null) {
      ctx.append(" DEFAULT ");
      visitNode(node.defaultTo(), ctx);
    }
  }

  protected void visitConstraint(ConstraintNode node, RenderCtx ctx) {
    if (node.name() != null) {
      ctx.append("CONSTRAINT ");
      visitNode(node.name(), ctx);
      ctx.append(" ");
    }
    if (node instanceof PrimaryKeyConstraintNode pk) {
      ctx.append("PRIMARY KEY (");
      visitList(pk.columns(), ctx);
      ctx.append(")");
    } else if (node instanceof UniqueConstraintNode uq) {
      ctx.append("UNIQUE (");
      visitList(uq.columns(), ctx);
      ctx.append(")");
    } else if (node instanceof ForeignKeyConstraintNode fk) {
      ctx.append("FOREIGN KEY (");
      visitList(fk.columns(), ctx);
      ctx.append(") REFERENCES ");
      visitNode(fk.references(), ctx);
      ctx.append(" (");
      visitList(fk.referencedColumns(), ctx);
      ctx.append(")");
      if (fk.onDelete() != null) ctx.append(" ON DELETE ").append(fk.onDelete().sql());
      if (fk.onUpdate() != null) ctx.append(" ON UPDATE ").append(fk.onUpdate().sql());
    } else if (node instanceof CheckConstraintNode ck) {
      ctx.append("CHECK (");
      visitNode(ck.expression(), ctx);
      ctx.append(")");
    }
  }

  protected void visitCreateTable(CreateTableNode node, RenderCtx ctx) {
    ctx.append("CREATE ");
    if (node.temporary()) ctx.append("TEMPORARY ");
    ctx.append("TABLE ");
    if (node.ifNotExists()) ctx.append("IF NOT EXISTS ");
    visitNode(node.table(), ctx);
    ctx.append(" (");
    List<OperationNode> elements = new ArrayList<>(node.columns());
    elements.addAll(node.constraints());
    visitList(elements, ctx);
    ctx.append(")");
  }

  protected void visitDropTable(DropTableNode node, RenderCtx ctx) {
    ctx.append("DROP TABLE ");
    if (node.ifExists()) ctx.append("IF EXISTS ");
    visitNode(node.table(), ctx);
    if (node.cascade()) ctx.append(" CASCADE");
  }

  protected void visitAlterTable(AlterTableNode node, RenderCtx ctx) {
    ctx.append("ALTER TABLE ");
    visitNode(node.table(), ctx);
    ctx.append(" ");
    visitList(node.actions(), ctx);
  }

  protected void visitCreateIndex(CreateIndexNode node, RenderCtx ctx) {
    ctx.append("CREATE ");
    if (node.unique()) ctx.append("UNIQUE ");
    ctx.append("INDEX ");
    if (node.ifNotExists()) ctx.append("IF NOT EXISTS ");
    visitNode(node.name(), ctx);
    ctx.append(" ON ");
    visitNode(node.table(), ctx);
    ctx.append(" (");
    visitList(node.columns(), ctx);
    ctx.append(")");
  }

  protected void visitDropIndex(DropIndexNode node, RenderCtx ctx) {
    ctx.append("DROP INDEX ");
    if (node.ifExists()) ctx.append("IF EXISTS ");
    visitNode(node.name(), ctx);
    if (node.cascade()) ctx.append(" CASCADE");
  }

  protected final void visitList(List<? extends OperationNode> nodes, RenderCtx ctx) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) ctx.append(", ");
      visitNode(nodes.get(i), ctx);
    }
  }

  private void visitClause(String keyword, OperationNode body, RenderCtx ctx) {
    ctx.append(keyword);
    visitNode(body, ctx);
  }

  private void appendOptional(OperationNode node, RenderCtx ctx) {
    if (node == null) return;
    ctx.append(" ");
    visitNode(node, ctx);
  }
}
