package io.intellixity.pagekit.search;

import io.intellixity.pagekit.query.Page;
import io.intellixity.pagekit.query.QueryElement;
import io.intellixity.pagekit.query.SortField;

import java.util.List;

/**
 * @param text  search text; blank keeps every filtered row
 * @param sort  explicit order; empty means best match first
 * @param page  cursor or offset page; null is the first forward page with the default size
 */
public record SearchRequest(String text, QueryElement filter, List<SortField> sort, Page page, boolean includeTotalCount) {
  public SearchRequest {
    sort = (sort == null) ? List.of() : List.copyOf(sort);
  }

  public static SearchRequest of(String text, Page page) {
    return new SearchRequest(text, null, List.of(), page, false);
  }

  public SearchRequest withFilter(QueryElement filter) {
    return new SearchRequest(text, filter, sort, page, includeTotalCount);
  }

  public SearchRequest withSort(List<SortField> sort) {
    return new SearchRequest(text, filter, sort, page, includeTotalCount);
  }

  public SearchRequest withTotalCount(boolean includeTotalCount) {
    return new SearchRequest(text, filter, sort, page, includeTotalCount);
  }
}
