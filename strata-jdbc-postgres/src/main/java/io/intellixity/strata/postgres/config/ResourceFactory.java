package io.intellixity.strata.postgres.config;

import java.sql.SQLException;

/** Creates a native resource (pool or client) on demand. */
@FunctionalInterface
public interface ResourceFactory<T> {
  T create() throws SQLException;
}
