package io.intellixity.strata.operation;

import java.util.List;
import java.util.Objects;

/** Argument checks shared by the node constructors. */
final class Nodes {
  private Nodes() {}

  static <T> List<T> copyNonEmpty(List<T> list, String name) {
    List<T> copy = List.copyOf(Objects.requireNonNull(list, name));
    if (copy.isEmpty()) throw new IllegalArgumentException(name + " must not be empty");
    return copy;
  }

  static <T> List<T> copyOrEmpty(List<T> list) {
    return list == null ? List.of() : List.copyOf(list);
  }

  static String requireText(String s, String name) {
    Objects.requireNonNull(s, name);
    if (s.isEmpty()) throw new IllegalArgumentException(name + " must not be empty");
    return s;
  }
}
