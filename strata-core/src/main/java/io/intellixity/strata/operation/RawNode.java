package io.intellixity.strata.operation;

import java.util.List;

/**
 * Raw SQL interleaved with child nodes:
 * {@code fragment[0] param[0] fragment[1] ... param[n-1] fragment[n]}.
 */
public record RawNode(List<String> sqlFragments, List<OperationNode> parameters) implements RootOperationNode {
  public RawNode {
    sqlFragments = Nodes.copyNonEmpty(sqlFragments, "sqlFragments");
    parameters = Nodes.copyOrEmpty(parameters);
    if (sqlFragments.size() != parameters.size() + 1) {
      throw new IllegalArgumentException("RawNode needs exactly one more fragment than parameters (fragments="
          + sqlFragments.size() + ", parameters=" + parameters.size() + ")");
    }
  }

  public static RawNode create(List<String> sqlFragments, List<? extends OperationNode> parameters) {
    return new RawNode(sqlFragments, List.copyOf(parameters));
  }

  public static RawNode createWithSql(String sql) {
    return new RawNode(List.of(sql), List.of());
  }

  public static RawNode createWithChild(OperationNode child) {
    return new RawNode(List.of("", ""), List.of(child));
  }

  @Override public NodeKind kind() { return NodeKind.RAW; }
}
