package io.intellixity.strata.error;

import java.sql.SQLException;

/**
 * Failure reported by the native database client.
 * <p>
 * Created at the call site that issued the statement, so its own stack trace points at the
 * caller while {@link #getCause()} keeps the client's original exception.
 */
public final class DatabaseException extends RuntimeException {
  private final String sqlState;

  public DatabaseException(String message, SQLException cause) {
    super(message + ": " + cause.getMessage(), cause);
    this.sqlState = cause.getSQLState();
  }

  public DatabaseException(SQLException cause) {
    this("Database call failed", cause);
  }

  /** SQLSTATE reported by the server, or null when the client did not provide one. */
  public String sqlState() {
    return sqlState;
  }
}
