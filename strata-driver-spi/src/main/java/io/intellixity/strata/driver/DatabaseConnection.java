package io.intellixity.strata.driver;

import io.intellixity.strata.compiler.CompiledQuery;

public interface DatabaseConnection {
  /**
   * Runs one statement.
   *
   * @throws io.intellixity.strata.error.DatabaseException if the database rejects it
   */
  QueryResult executeQuery(CompiledQuery query);

  /**
   * Runs one statement through a server-side cursor, yielding rows in batches of at most
   * {@code chunkSize}. The returned stream must be closed; closing it closes the cursor.
   *
   * @throws io.intellixity.strata.error.DialectConfigurationException if the dialect has no cursor support
   * @throws IllegalArgumentException if {@code chunkSize} is not positive
   */
  ResultStream streamQuery(CompiledQuery query, int chunkSize);
}
