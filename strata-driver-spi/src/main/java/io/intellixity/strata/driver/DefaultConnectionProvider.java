package io.intellixity.strata.driver;

import java.util.Objects;
import java.util.function.Function;

public final class DefaultConnectionProvider implements ConnectionProvider {
  private final Driver driver;

  public DefaultConnectionProvider(Driver driver) {
    this.driver = Objects.requireNonNull(driver, "driver");
  }

  @Override
  public <T> T withConnection(Function<DatabaseConnection, T> work) {
    Objects.requireNonNull(work, "work");
    DatabaseConnection connection = driver.acquireConnection();
    try {
      return work.apply(connection);
    } finally {
      driver.releaseConnection(connection);
    }
  }
}
