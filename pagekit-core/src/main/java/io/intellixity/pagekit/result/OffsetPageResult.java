package io.intellixity.pagekit.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OffsetPageResult<T>(List<T> items,
                                  int page,
                                  int pageSize,
                                  Integer totalPages,
                                  Long totalCount,
                                  boolean hasNext,
                                  boolean hasPrevious) {
  public OffsetPageResult {
    items = List.copyOf(items);
  }
}
