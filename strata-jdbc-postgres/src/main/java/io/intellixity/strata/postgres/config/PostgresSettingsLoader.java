package io.intellixity.strata.postgres.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads {@link PostgresConnectionSettings} from YAML or JSON.
 *
 * The settings may sit at the document root or under a top-level {@code postgres:} key.
 */
public final class PostgresSettingsLoader {
  private static final ObjectMapper YAML = new YAMLMapper();
  private static final ObjectMapper JSON = new ObjectMapper();

  private PostgresSettingsLoader() {}

  public static PostgresConnectionSettings load(Path path) {
    Objects.requireNonNull(path, "path");
    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
    ObjectMapper mapper = name.endsWith(".json") ? JSON : YAML;
    try (InputStream in = Files.newInputStream(path)) {
      return read(mapper, in, path.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read postgres settings: " + path, e);
    }
  }

  /** Loads a classpath resource; {@code .json} resources are read as JSON, anything else as YAML. */
  public static PostgresConnectionSettings loadResource(String resource) {
    Objects.requireNonNull(resource, "resource");
    ObjectMapper mapper = resource.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON : YAML;
    InputStream in = PostgresSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) throw new IllegalArgumentException("Settings resource not found: " + resource);
    try (in) {
      return read(mapper, in, resource);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read postgres settings: " + resource, e);
    }
  }

  public static PostgresConnectionSettings fromYaml(String yaml) {
    return parse(YAML, yaml);
  }

  public static PostgresConnectionSettings fromJson(String json) {
    return parse(JSON, json);
  }

  private static PostgresConnectionSettings parse(ObjectMapper mapper, String text) {
    Objects.requireNonNull(text, "text");
    try {
      return convert(mapper, mapper.readTree(text), "<inline>");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to parse postgres settings", e);
    }
  }

  private static PostgresConnectionSettings read(ObjectMapper mapper, InputStream in, String source) throws IOException {
    return convert(mapper, mapper.readTree(in), source);
  }

  private static PostgresConnectionSettings convert(ObjectMapper mapper, JsonNode root, String source) throws IOException {
    if (root == null || root.isMissingNode() || root.isNull()) {
      throw new IllegalArgumentException("Empty postgres settings: " + source);
    }
    JsonNode node = root.has("postgres") ? root.get("postgres") : root;
    return mapper.treeToValue(node, PostgresConnectionSettings.class);
  }
}
