package io.intellixity.strata.driver;

/**
 * @param isolationLevel requested level, or null for the database default
 */
public record TransactionSettings(IsolationLevel isolationLevel) {
  private static final TransactionSettings NONE = new TransactionSettings(null);

  public static TransactionSettings none() {
    return NONE;
  }

  public static TransactionSettings of(IsolationLevel isolationLevel) {
    return new TransactionSettings(isolationLevel);
  }
}
