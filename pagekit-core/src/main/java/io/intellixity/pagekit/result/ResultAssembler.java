package io.intellixity.pagekit.result;

import io.intellixity.pagekit.page.PageWindow;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.search.SearchEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/** Turns a {@link PageWindow} into one of the wire envelopes. */
public final class ResultAssembler {

  public Object assemble(PageWindow window, Shape shape) {
    Objects.requireNonNull(shape, "shape");
    return switch (shape) {
      case OFFSET_PAGE -> offsetPage(window);
      case CONNECTION -> connection(window);
      case CURSOR_LIST -> cursorList(window);
      case RANKED_LIST -> rankedList(window);
    };
  }

  public OffsetPageResult<Row> offsetPage(PageWindow window) {
    return offsetPage(window, Function.identity());
  }

  public <T> OffsetPageResult<T> offsetPage(PageWindow window, Function<Row, T> mapper) {
    Objects.requireNonNull(window, "window");
    int page = (window.page() == null) ? 1 : window.page();
    return new OffsetPageResult<>(map(window.items(), mapper), page, window.pageSize(), window.totalPages(),
        window.totalCount(), window.hasNext(), window.hasPrevious());
  }

  public Connection<Row> connection(PageWindow window) {
    return connection(window, Function.identity());
  }

  public <T> Connection<T> connection(PageWindow window, Function<Row, T> mapper) {
    Objects.requireNonNull(window, "window");
    List<Connection.Edge<T>> edges = new ArrayList<>(window.items().size());
    for (Row r : window.items()) {
      edges.add(new Connection.Edge<>(window.cursorFor(r), mapper.apply(r)));
    }
    String start = edges.isEmpty() ? null : edges.get(0).cursor();
    String end = edges.isEmpty() ? null : edges.get(edges.size() - 1).cursor();
    return new Connection<>(edges, new Connection.PageInfo(window.hasNext(), window.hasPrevious(), start, end),
        window.totalCount());
  }

  public CursorListResult<Row> cursorList(PageWindow window) {
    return cursorList(window, Function.identity());
  }

  public <T> CursorListResult<T> cursorList(PageWindow window, Function<Row, T> mapper) {
    Objects.requireNonNull(window, "window");
    String next = window.hasNext() ? window.endCursor() : null;
    String prev = window.hasPrevious() ? window.startCursor() : null;
    return new CursorListResult<>(map(window.items(), mapper), window.pageSize(), window.hasNext(),
        window.hasPrevious(), next, prev, window.totalCount());
  }

  /** Rows must carry the {@link SearchEngine#SCORE_FIELD score} attribute; it is stripped from the nodes. */
  public RankedList<Row> rankedList(PageWindow window) {
    return rankedList(window, Function.identity());
  }

  public <T> RankedList<T> rankedList(PageWindow window, Function<Row, T> mapper) {
    Objects.requireNonNull(window, "window");
    List<RankedList.ScoredItem<T>> results = new ArrayList<>(window.items().size());
    for (Row r : window.items()) {
      Object score = r.get(SearchEngine.SCORE_FIELD);
      double s = (score instanceof Number n) ? n.doubleValue() : 0d;
      results.add(new RankedList.ScoredItem<>(mapper.apply(r.without(SearchEngine.SCORE_FIELD)), s));
    }
    String next = window.hasNext() ? window.endCursor() : null;
    return new RankedList<>(results, next, window.hasNext(), window.totalCount());
  }

  private static <T> List<T> map(List<Row> rows, Function<Row, T> mapper) {
    List<T> out = new ArrayList<>(rows.size());
    for (Row r : rows) out.add(mapper.apply(r));
    return out;
  }
}
