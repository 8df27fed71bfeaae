package io.intellixity.strata.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Runs work inside a new transaction on a dedicated connection.
 * <p>
 * Begin, work, commit. If the work (or the commit) fails the transaction is rolled back and
 * the original failure is rethrown, with any rollback failure attached as suppressed. The
 * connection is always released.
 */
public final class TransactionRunner {
  private static final Logger log = LoggerFactory.getLogger(TransactionRunner.class);

  private final Driver driver;

  public TransactionRunner(Driver driver) {
    this.driver = Objects.requireNonNull(driver, "driver");
  }

  public <T> T inTransaction(Function<DatabaseConnection, T> work) {
    return inTransaction(TransactionSettings.none(), work);
  }

  public <T> T inTransaction(TransactionSettings settings, Function<DatabaseConnection, T> work) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(work, "work");
    DatabaseConnection connection = driver.acquireConnection();
    try {
      driver.beginTransaction(connection, settings);
      T result;
      try {
        result = work.apply(connection);
        driver.commitTransaction(connection);
      } catch (RuntimeException | Error e) {
        rollbackQuietly(connection, e);
        throw e;
      }
      return result;
    } finally {
      driver.releaseConnection(connection);
    }
  }

  private void rollbackQuietly(DatabaseConnection connection, Throwable primary) {
    try {
      driver.rollbackTransaction(connection);
    } catch (RuntimeException rollbackFailure) {
      log.debug("strata.tx rollback_failed error={}", rollbackFailure.toString());
      primary.addSuppressed(rollbackFailure);
    }
  }
}
