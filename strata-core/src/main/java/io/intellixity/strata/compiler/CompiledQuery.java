package io.intellixity.strata.compiler;

import io.intellixity.strata.operation.RawNode;
import io.intellixity.strata.operation.RootOperationNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Final SQL text plus its ordered parameters.
 *
 * @param parameters one entry per placeholder, in placeholder order; entries may be null
 * @param query the AST the SQL was compiled from
 */
public record CompiledQuery(String sql, List<Object> parameters, RootOperationNode query) {
  public CompiledQuery {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(query, "query");
    // List.copyOf rejects nulls, and SQL NULL parameters are legal here.
    parameters = (parameters == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
  }

  public static CompiledQuery raw(String sql) {
    return raw(sql, List.of());
  }

  public static CompiledQuery raw(String sql, List<?> parameters) {
    return new CompiledQuery(sql, new ArrayList<>(parameters), RawNode.createWithSql(sql));
  }
}
