package io.intellixity.pagekit;

import io.intellixity.pagekit.cursor.CursorCodec;
import io.intellixity.pagekit.cursor.JsonCursorCodec;
import io.intellixity.pagekit.filter.FilterEngine;
import io.intellixity.pagekit.page.PageWindow;
import io.intellixity.pagekit.page.PaginationController;
import io.intellixity.pagekit.page.PagingConfig;
import io.intellixity.pagekit.query.Query;
import io.intellixity.pagekit.query.QueryElement;
import io.intellixity.pagekit.query.SortField;
import io.intellixity.pagekit.result.*;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.row.RowSource;
import io.intellixity.pagekit.search.RelevanceScorer;
import io.intellixity.pagekit.search.SearchEngine;
import io.intellixity.pagekit.search.SearchField;
import io.intellixity.pagekit.search.SearchRequest;
import io.intellixity.pagekit.sort.SortEngine;
import io.intellixity.pagekit.stream.CancellationSignal;
import io.intellixity.pagekit.stream.RowStreamer;
import io.intellixity.pagekit.stream.StreamSummary;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Entry point wiring the filter, sort, cursor, paging, search and streaming components around one
 * {@link PagingConfig}. Stateless between calls and safe to share across threads.
 */
public final class PagingEngine {
  private final PagingConfig config;
  private final FilterEngine filters;
  private final SortEngine sorter;
  private final CursorCodec codec;
  private final PaginationController controller;
  private final ResultAssembler assembler;
  private final RowStreamer streamer;
  private final SearchEngine search;

  public PagingEngine(PagingConfig config, List<SearchField> searchFields) {
    this(config, new JsonCursorCodec(), searchFields);
  }

  public PagingEngine(PagingConfig config, CursorCodec codec, List<SearchField> searchFields) {
    this.config = Objects.requireNonNull(config, "config");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.filters = new FilterEngine(config.filterOptions());
    this.sorter = new SortEngine();
    this.controller = new PaginationController(config, filters, sorter, codec);
    this.assembler = new ResultAssembler();
    this.streamer = new RowStreamer(filters, sorter);
    this.search = (searchFields == null || searchFields.isEmpty())
        ? null
        : new SearchEngine(controller, filters, sorter, new RelevanceScorer(searchFields));
  }

  public static PagingEngine defaults() {
    return new PagingEngine(PagingConfig.defaults(), List.of());
  }

  public PagingConfig config() { return config; }
  public CursorCodec codec() { return codec; }
  public FilterEngine filters() { return filters; }
  public SortEngine sorter() { return sorter; }
  public ResultAssembler assembler() { return assembler; }

  public PageWindow paginate(RowSource source, Query query) {
    return controller.paginate(source, query);
  }

  public PageWindow search(RowSource source, SearchRequest request) {
    if (search == null) throw new IllegalStateException("No search fields configured");
    return search.search(source, request);
  }

  public StreamSummary stream(RowSource source, QueryElement filter, List<SortField> sort, long limit,
                              CancellationSignal signal, Consumer<? super Row> sink) {
    return streamer.stream(source, filter, sort, limit, signal, sink);
  }

  public Stream<Row> lazy(RowSource source, QueryElement filter, List<SortField> sort, long limit,
                          CancellationSignal signal) {
    return streamer.lazy(source, filter, sort, limit, signal);
  }

  public Object assemble(PageWindow window, Shape shape) {
    return assembler.assemble(window, shape);
  }
}
