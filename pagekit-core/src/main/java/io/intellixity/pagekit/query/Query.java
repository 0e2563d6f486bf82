package io.intellixity.pagekit.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/** Canonical request triple (filter, sort, page) plus the optional total-count flag. */
@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query {
  private QueryElement filter;
  private Page page;
  private List<SortField> sort = new ArrayList<>();
  private boolean includeTotalCount;

  public Query() {}

  public QueryElement filter() { return filter; }
  public Page page() { return page; }
  public List<SortField> sort() { return sort; }
  /** Total count forces a full scan of the filtered set, so it is opt-in. */
  public boolean includeTotalCount() { return includeTotalCount; }

  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  public Query withPage(Page page) { this.page = page; return this; }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public Query withSort(SortField... sort) { return withSort(List.of(sort)); }
  public Query withTotalCount(boolean includeTotalCount) { this.includeTotalCount = includeTotalCount; return this; }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  public static Query and(QueryElement... elements) {
    return Query.of(QueryFilters.and(elements));
  }

  public static Query or(QueryElement... elements) {
    return Query.of(QueryFilters.or(elements));
  }
}
