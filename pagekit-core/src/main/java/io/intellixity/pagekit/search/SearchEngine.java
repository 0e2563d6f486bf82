package io.intellixity.pagekit.search;

import io.intellixity.pagekit.filter.FilterEngine;
import io.intellixity.pagekit.page.PageWindow;
import io.intellixity.pagekit.page.PaginationController;
import io.intellixity.pagekit.query.SortField;
import io.intellixity.pagekit.row.FieldType;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.row.RowSchema;
import io.intellixity.pagekit.row.RowSource;
import io.intellixity.pagekit.sort.SortEngine;
import io.intellixity.pagekit.sort.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Relevance search: filter, score, drop non-matches, order and window.
 *
 * <p>Scores travel on the rows as the synthetic {@link #SCORE_FIELD} attribute so they take part in the
 * default ordering ({@code _score DESC, id ASC}) and in cursor keys.</p>
 */
public final class SearchEngine {
  private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);

  public static final String SCORE_FIELD = "_score";

  private final PaginationController controller;
  private final FilterEngine filters;
  private final SortEngine sorter;
  private final RelevanceScorer scorer;

  public SearchEngine(PaginationController controller, FilterEngine filters, SortEngine sorter, RelevanceScorer scorer) {
    this.controller = Objects.requireNonNull(controller, "controller");
    this.filters = Objects.requireNonNull(filters, "filters");
    this.sorter = Objects.requireNonNull(sorter, "sorter");
    this.scorer = Objects.requireNonNull(scorer, "scorer");
  }

  public RelevanceScorer scorer() { return scorer; }

  public PageWindow search(RowSource source, SearchRequest request) {
    Objects.requireNonNull(source, "source");
    return search(source.snapshot(), request);
  }

  public PageWindow search(Collection<Row> rows, SearchRequest request) {
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(request, "request");

    RowSchema schema = filters.options().schema();
    sorter.validate(request.sort(), schema == null ? null : schema.with(SCORE_FIELD, FieldType.FLOAT));

    List<Row> filtered = filters.filter(List.copyOf(rows), request.filter());
    List<Row> scored = new ArrayList<>(filtered.size());
    for (Row r : filtered) {
      double s = scorer.score(r, request.text());
      if (s > 0) scored.add(r.with(SCORE_FIELD, s));
    }

    SortSpec spec = request.sort().isEmpty()
        ? SortSpec.of(SortField.desc(SCORE_FIELD))
        : SortSpec.of(request.sort());
    List<Row> ordered = sorter.orderedSequence(scored, spec);

    PageWindow w = controller.window(ordered, spec, request.page(), request.includeTotalCount());
    if (log.isDebugEnabled()) {
      log.debug("pagekit.search text={} filtered={} matched={} window={} hasNext={}",
          request.text(), filtered.size(), scored.size(), w.items().size(), w.hasNext());
    }
    return w;
  }
}
