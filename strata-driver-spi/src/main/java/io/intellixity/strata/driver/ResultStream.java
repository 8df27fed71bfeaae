package io.intellixity.strata.driver;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily fetched batches of a streamed query.
 * <p>
 * Each {@link #next()} reads one batch from the database. The underlying cursor is closed
 * when the batches run out, when a read fails, or on {@link #close()}, whichever comes first.
 */
public interface ResultStream extends Iterator<QueryResult>, AutoCloseable {
  /** Closes the cursor. Idempotent. */
  @Override
  void close();

  /** Sequential stream view; closing the stream closes this. */
  default Stream<QueryResult> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
        .onClose(this::close);
  }
}
