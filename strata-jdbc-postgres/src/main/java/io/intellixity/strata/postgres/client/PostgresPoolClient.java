package io.intellixity.strata.postgres.client;

/** A client checked out of a {@link PostgresPool}. */
public interface PostgresPoolClient extends PostgresClient {
  /** Returns the client to its pool. */
  void release();
}
