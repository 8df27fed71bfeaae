package io.intellixity.strata.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class LazyTest {
  @Test
  void resolvesOnceAcrossConcurrentCallers() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    Lazy<Object> lazy = Lazy.of(() -> {
      calls.incrementAndGet();
      return new Object();
    });

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<Object>> futures = new java.util.ArrayList<>();
      for (int i = 0; i < 8; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return lazy.get();
        }));
      }
      start.countDown();
      Object first = futures.get(0).get(5, TimeUnit.SECONDS);
      for (Future<Object> f : futures) assertSame(first, f.get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, calls.get());
    assertTrue(lazy.isResolved());
  }

  @Test
  void failedSupplierIsRetriedOnNextCall() {
    AtomicInteger calls = new AtomicInteger();
    Lazy<String> lazy = Lazy.of(() -> {
      if (calls.incrementAndGet() == 1) throw new IllegalStateException("boom");
      return "ok";
    });

    assertThrows(IllegalStateException.class, lazy::get);
    assertFalse(lazy.isResolved());
    assertEquals("ok", lazy.get());
    assertEquals(2, calls.get());
  }

  @Test
  void resolvedCellNeverCallsSupplier() {
    Lazy<String> lazy = Lazy.resolved("v");
    assertTrue(lazy.isResolved());
    assertEquals("v", lazy.get());
  }

  @Test
  void nullResultIsRejected() {
    Lazy<String> lazy = Lazy.of(() -> null);
    assertThrows(NullPointerException.class, lazy::get);
  }
}
