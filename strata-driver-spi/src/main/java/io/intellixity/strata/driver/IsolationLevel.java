package io.intellixity.strata.driver;

public enum IsolationLevel {
  READ_UNCOMMITTED("read uncommitted"),
  READ_COMMITTED("read committed"),
  REPEATABLE_READ("repeatable read"),
  SERIALIZABLE("serializable"),
  SNAPSHOT("snapshot");

  private final String sql;

  IsolationLevel(String sql) {
    this.sql = sql;
  }

  /** Lowercase SQL spelling, as used after {@code isolation level}. */
  public String sql() {
    return sql;
  }
}
