package io.intellixity.strata.postgres.client;

import java.sql.SQLException;

public interface PostgresPool {
  /** Checks out a client. The same physical client may be handed out again after release. */
  PostgresPoolClient connect() throws SQLException;

  /** Closes every client and shuts the pool down. */
  void end() throws SQLException;
}
