package io.intellixity.pagekit.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Relay-style connection: edges carrying per-node cursors plus {@link PageInfo}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Connection<T>(List<Edge<T>> edges, PageInfo pageInfo, Long totalCount) {
  public Connection {
    edges = List.copyOf(edges);
  }

  public record Edge<T>(String cursor, T node) {}

  /** Cursors are null for an empty window. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record PageInfo(boolean hasNextPage, boolean hasPreviousPage, String startCursor, String endCursor) {}
}
