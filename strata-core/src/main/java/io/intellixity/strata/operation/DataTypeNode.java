package io.intellixity.strata.operation;

import java.util.Objects;
import java.util.regex.Pattern;

/** Column type rendered verbatim, e.g. {@code varchar(255)} or {@code timestamp with time zone}. */
public record DataTypeNode(String dataType) implements OperationNode {
  private static final Pattern TYPE = Pattern.compile("[A-Za-z][A-Za-z0-9 _(),\\[\\]]*");

  public DataTypeNode {
    Objects.requireNonNull(dataType, "dataType");
    if (!TYPE.matcher(dataType).matches()) throw new IllegalArgumentException("Invalid data type: " + dataType);
  }

  public static DataTypeNode create(String dataType) {
    return new DataTypeNode(dataType);
  }

  @Override public NodeKind kind() { return NodeKind.DATA_TYPE; }
}
