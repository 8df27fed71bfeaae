package io.intellixity.strata.dialect;

import io.intellixity.strata.compiler.QueryCompiler;
import io.intellixity.strata.driver.ConnectionProvider;
import io.intellixity.strata.driver.Driver;

/** Everything database-specific, behind one factory. */
public interface Dialect {
  Driver createDriver();

  QueryCompiler createQueryCompiler();

  DialectAdapter createAdapter();

  DatabaseIntrospector createIntrospector(ConnectionProvider connections);
}
