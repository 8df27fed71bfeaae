package io.intellixity.strata.postgres.client;

import java.sql.SQLException;

/** A standalone client owning one connection. */
public interface PostgresSingleClient extends PostgresClient {
  void connect() throws SQLException;

  void end() throws SQLException;
}
