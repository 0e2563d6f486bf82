package io.intellixity.pagekit.stream;

import io.intellixity.pagekit.row.Row;

import java.util.List;
import java.util.Objects;
import java.util.Spliterator;
import java.util.function.Consumer;

/**
 * Sequential spliterator over an ordered row list that stops once the signal reports cancellation or
 * the limit is reached. Not splittable.
 */
final class CancellableRowSpliterator implements Spliterator<Row> {
  private final List<Row> rows;
  private final long limit;
  private final CancellationSignal signal;
  private int index;
  private long emitted;
  private boolean cancelled;

  CancellableRowSpliterator(List<Row> rows, long limit, CancellationSignal signal) {
    this.rows = Objects.requireNonNull(rows, "rows");
    this.limit = (limit <= 0) ? Long.MAX_VALUE : limit;
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  @Override
  public boolean tryAdvance(Consumer<? super Row> action) {
    if (cancelled || index >= rows.size() || emitted >= limit) return false;
    if (signal.isCancelled()) {
      cancelled = true;
      return false;
    }
    action.accept(rows.get(index++));
    emitted++;
    return true;
  }

  @Override
  public Spliterator<Row> trySplit() {
    return null;
  }

  @Override
  public long estimateSize() {
    return Math.min(rows.size() - index, limit - emitted);
  }

  @Override
  public int characteristics() {
    return ORDERED | NONNULL | IMMUTABLE;
  }

  boolean cancelled() { return cancelled; }
  long emittedCount() { return emitted; }
}
