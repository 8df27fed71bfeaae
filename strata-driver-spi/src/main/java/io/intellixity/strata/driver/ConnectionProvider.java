package io.intellixity.strata.driver;

import java.util.function.Function;

/** Scoped access to a connection: acquired before {@code work}, released after it. */
public interface ConnectionProvider {
  <T> T withConnection(Function<DatabaseConnection, T> work);
}
