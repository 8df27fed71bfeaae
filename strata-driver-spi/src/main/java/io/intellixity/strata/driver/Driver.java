package io.intellixity.strata.driver;

/**
 * Connection and transaction lifecycle for one database.
 * <p>
 * All calls block. A driver is shared across threads; each {@link DatabaseConnection} it hands
 * out is used by one caller at a time between acquire and release.
 */
public interface Driver {
  /** Prepares the driver. Called once before any other method. */
  void init();

  DatabaseConnection acquireConnection();

  void beginTransaction(DatabaseConnection connection, TransactionSettings settings);

  void commitTransaction(DatabaseConnection connection);

  void rollbackTransaction(DatabaseConnection connection);

  /** Gives the connection back. Does not close it. */
  void releaseConnection(DatabaseConnection connection);

  /** Shuts down the underlying client or pool. A second call is a no-op. */
  void destroy();
}
