package io.intellixity.strata.postgres.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Declarative connection settings, as read from YAML or JSON by {@link PostgresSettingsLoader}.
 *
 * @param schema default search_path schema, or null
 * @param streaming whether the dialect is wired with a cursor factory
 */
@JsonIgnoreProperties(ignoreUnknown = false)
public record PostgresConnectionSettings(
    String jdbcUrl,
    String username,
    String password,
    String schema,
    Integer maximumPoolSize,
    Integer minimumIdle,
    Long connectionTimeoutMs,
    String applicationName,
    Boolean streaming
) {
  public static final int DEFAULT_MAXIMUM_POOL_SIZE = 10;
  public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 30_000L;
  public static final String DEFAULT_APPLICATION_NAME = "strata";

  public PostgresConnectionSettings {
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    if (!jdbcUrl.startsWith("jdbc:postgresql:")) {
      throw new IllegalArgumentException("jdbcUrl must start with jdbc:postgresql: but was " + jdbcUrl);
    }
    if (maximumPoolSize == null) maximumPoolSize = DEFAULT_MAXIMUM_POOL_SIZE;
    if (maximumPoolSize <= 0) throw new IllegalArgumentException("maximumPoolSize must be > 0");
    if (minimumIdle != null && (minimumIdle < 0 || minimumIdle > maximumPoolSize)) {
      throw new IllegalArgumentException("minimumIdle must be between 0 and maximumPoolSize");
    }
    if (connectionTimeoutMs == null) connectionTimeoutMs = DEFAULT_CONNECTION_TIMEOUT_MS;
    if (applicationName == null || applicationName.isBlank()) applicationName = DEFAULT_APPLICATION_NAME;
    if (schema != null && schema.isBlank()) schema = null;
    if (streaming == null) streaming = Boolean.TRUE;
  }

  public static PostgresConnectionSettings of(String jdbcUrl, String username, String password) {
    return new PostgresConnectionSettings(jdbcUrl, username, password, null, null, null, null, null, null);
  }

  /** Password masked, for logging. */
  @Override
  public String toString() {
    return "PostgresConnectionSettings[jdbcUrl=" + jdbcUrl + ", username=" + username
        + ", password=" + (password == null ? "null" : "***") + ", schema=" + schema
        + ", maximumPoolSize=" + maximumPoolSize + ", minimumIdle=" + minimumIdle
        + ", connectionTimeoutMs=" + connectionTimeoutMs + ", applicationName=" + applicationName
        + ", streaming=" + streaming + "]";
  }
}
