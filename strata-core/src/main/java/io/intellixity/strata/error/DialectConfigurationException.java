package io.intellixity.strata.error;

/**
 * Raised when a dialect is asked to do something its configuration cannot support
 * (missing streaming capability, unrenderable AST node, ...).
 * <p>
 * Fatal: callers should fix the configuration, not retry.
 */
public class DialectConfigurationException extends RuntimeException {
  public DialectConfigurationException(String message) {
    super(message);
  }

  public DialectConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
