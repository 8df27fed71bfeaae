package io.intellixity.strata.util;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Compute-once cell.
 * <p>
 * Concurrent first callers block until one of them has produced the value; everyone sees the
 * same instance afterwards. A supplier that throws leaves the cell empty so a later call can
 * try again.
 */
public final class Lazy<T> implements Supplier<T> {
  private final Supplier<? extends T> supplier;
  private volatile T value;

  private Lazy(Supplier<? extends T> supplier) {
    this.supplier = Objects.requireNonNull(supplier, "supplier");
  }

  public static <T> Lazy<T> of(Supplier<? extends T> supplier) {
    return new Lazy<>(supplier);
  }

  /** Already-resolved cell; the supplier is never consulted. */
  public static <T> Lazy<T> resolved(T value) {
    Lazy<T> lazy = new Lazy<>(() -> value);
    lazy.value = Objects.requireNonNull(value, "value");
    return lazy;
  }

  @Override
  public T get() {
    T v = value;
    if (v != null) return v;
    synchronized (this) {
      v = value;
      if (v == null) {
        v = Objects.requireNonNull(supplier.get(), "Lazy supplier returned null");
        value = v;
      }
      return v;
    }
  }

  public boolean isResolved() {
    return value != null;
  }
}
