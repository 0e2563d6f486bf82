package io.intellixity.pagekit.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Search results, best match first unless the request carried its own sort. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RankedList<T>(List<ScoredItem<T>> results, String nextCursor, boolean hasMore, Long totalCount) {
  public RankedList {
    results = List.copyOf(results);
  }

  public record ScoredItem<T>(T node, double score) {}
}
