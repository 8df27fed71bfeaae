package io.intellixity.strata.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Driver decorator used by the execution layer.
 * <p>
 * Initializes the wrapped driver lazily on the first acquire (concurrent first callers wait for
 * the same init). After {@link #destroy()} it refuses new connections, and the wrapped driver
 * is destroyed at most once. Connections are handed out exactly as the wrapped driver returns them.
 */
public final class RuntimeDriver implements Driver {
  private static final Logger log = LoggerFactory.getLogger(RuntimeDriver.class);

  private final Driver driver;
  private final Object lock = new Object();
  private volatile boolean initialized;
  private volatile boolean destroyed;

  public RuntimeDriver(Driver driver) {
    this.driver = Objects.requireNonNull(driver, "driver");
  }

  @Override
  public void init() {
    if (initialized) return;
    synchronized (lock) {
      if (destroyed) throw new IllegalStateException("Driver has been destroyed");
      if (initialized) return;
      driver.init();
      initialized = true;
      log.debug("strata.driver op=init driver={}", driver.getClass().getSimpleName());
    }
  }

  @Override
  public DatabaseConnection acquireConnection() {
    if (destroyed) throw new IllegalStateException("Driver has been destroyed");
    init();
    return driver.acquireConnection();
  }

  @Override
  public void beginTransaction(DatabaseConnection connection, TransactionSettings settings) {
    driver.beginTransaction(connection, settings);
  }

  @Override
  public void commitTransaction(DatabaseConnection connection) {
    driver.commitTransaction(connection);
  }

  @Override
  public void rollbackTransaction(DatabaseConnection connection) {
    driver.rollbackTransaction(connection);
  }

  @Override
  public void releaseConnection(DatabaseConnection connection) {
    driver.releaseConnection(connection);
  }

  @Override
  public void destroy() {
    synchronized (lock) {
      if (destroyed) return;
      destroyed = true;
      if (!initialized) return;
    }
    log.debug("strata.driver op=destroy");
    driver.destroy();
  }
}
