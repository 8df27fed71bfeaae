package io.intellixity.strata.dialect;

import java.util.Objects;

public record SchemaMetadata(String name) {
  public SchemaMetadata {
    Objects.requireNonNull(name, "name");
  }
}
