package io.intellixity.pagekit.stream;

import io.intellixity.pagekit.filter.FilterEngine;
import io.intellixity.pagekit.query.QueryElement;
import io.intellixity.pagekit.query.SortField;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.row.RowSource;
import io.intellixity.pagekit.sort.SortEngine;
import io.intellixity.pagekit.sort.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Unbounded ordered emission: filter and sort once (sorting needs the whole filtered set), then hand
 * rows out one at a time, polling the {@link CancellationSignal} before each.
 */
public final class RowStreamer {
  private static final Logger log = LoggerFactory.getLogger(RowStreamer.class);

  private final FilterEngine filters;
  private final SortEngine sorter;

  public RowStreamer(FilterEngine filters, SortEngine sorter) {
    this.filters = Objects.requireNonNull(filters, "filters");
    this.sorter = Objects.requireNonNull(sorter, "sorter");
  }

  /**
   * Push rows to {@code sink} until the sequence or {@code limit} is exhausted or the signal fires.
   *
   * @param limit maximum rows to emit; {@code <= 0} means no limit
   */
  public StreamSummary stream(RowSource source,
                              QueryElement filter,
                              List<SortField> sort,
                              long limit,
                              CancellationSignal signal,
                              Consumer<? super Row> sink) {
    Objects.requireNonNull(sink, "sink");
    CancellableRowSpliterator it = spliterator(source, filter, sort, limit, signal);
    it.forEachRemaining(sink);
    StreamSummary summary = new StreamSummary(it.emittedCount(), it.cancelled());
    if (log.isDebugEnabled()) {
      log.debug("pagekit.stream emitted={} cancelled={} limit={}", summary.emitted(), summary.cancelled(), limit);
    }
    return summary;
  }

  /** Lazy view of the same sequence; the caller closes or abandons it freely. */
  public Stream<Row> lazy(RowSource source, QueryElement filter, List<SortField> sort, long limit, CancellationSignal signal) {
    return StreamSupport.stream(spliterator(source, filter, sort, limit, signal), false);
  }

  private CancellableRowSpliterator spliterator(RowSource source,
                                                QueryElement filter,
                                                List<SortField> sort,
                                                long limit,
                                                CancellationSignal signal) {
    Objects.requireNonNull(source, "source");
    SortSpec spec = SortSpec.of(sort);
    sorter.validate(sort, filters.options().schema());
    List<Row> ordered = sorter.orderedSequence(filters.filter(source.snapshot(), filter), spec);
    return new CancellableRowSpliterator(ordered, limit, signal == null ? CancellationSignal.NONE : signal);
  }
}
