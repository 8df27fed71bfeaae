package io.intellixity.strata.operation;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/** Function call such as {@code count(*)} or {@code lower("name")}. The name is rendered verbatim. */
public record FunctionNode(String name, List<OperationNode> arguments) implements OperationNode {
  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  public FunctionNode {
    Objects.requireNonNull(name, "name");
    if (!NAME.matcher(name).matches()) throw new IllegalArgumentException("Invalid function name: " + name);
    arguments = Nodes.copyOrEmpty(arguments);
  }

  public static FunctionNode create(String name, List<? extends OperationNode> arguments) {
    return new FunctionNode(name, List.copyOf(arguments));
  }

  public static FunctionNode create(String name, OperationNode... arguments) {
    return new FunctionNode(name, List.of(arguments));
  }

  @Override public NodeKind kind() { return NodeKind.FUNCTION; }
}
