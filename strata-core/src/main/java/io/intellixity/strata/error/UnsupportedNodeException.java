package io.intellixity.strata.error;

import io.intellixity.strata.operation.NodeKind;

import java.util.Objects;

/** The dialect's compiler has no rendering rule for a node kind (or operator) it was given. */
public final class UnsupportedNodeException extends DialectConfigurationException {
  private final NodeKind kind;
  private final String dialect;

  public UnsupportedNodeException(NodeKind kind, String dialect) {
    this(kind, dialect, kind == null ? "<null>" : kind.label());
  }

  public UnsupportedNodeException(NodeKind kind, String dialect, String construct) {
    super("'" + construct + "' is not supported by dialect: " + dialect);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.dialect = dialect;
  }

  public NodeKind kind() { return kind; }
  public String dialect() { return dialect; }
}
