package io.intellixity.pagekit.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Flat cursor envelope for query-string clients. {@code nextCursor} continues forward,
 * {@code prevCursor} is meant for {@code direction=backward}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CursorListResult<T>(List<T> data,
                                  int limit,
                                  boolean hasMore,
                                  boolean hasPrevious,
                                  String nextCursor,
                                  String prevCursor,
                                  Long totalCount) {
  public CursorListResult {
    data = List.copyOf(data);
  }
}
