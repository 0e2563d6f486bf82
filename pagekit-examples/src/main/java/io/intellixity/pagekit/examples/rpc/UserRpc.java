package io.intellixity.pagekit.examples.rpc;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.intellixity.pagekit.row.Row;

import java.util.List;

/** Request and response messages of the {@code users.v1.UserService} RPC surface. */
public final class UserRpc {
  private UserRpc() {}

  public static final String SERVICE = "users.v1.UserService";

  public record GetUserRequest(String id) {}

  /** @param pageSize 0 means the configured default; pageNumber below 1 means the first page */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ListUsersOffsetRequest(int pageSize, int pageNumber, UserFilter filter, UserSort sort) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ListUsersOffsetResponse(List<Row> users,
                                        long totalCount,
                                        int totalPages,
                                        int currentPage,
                                        boolean hasNextPage,
                                        boolean hasPreviousPage) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ListUsersCursorRequest(int pageSize, String pageToken, UserFilter filter, UserSort sort,
                                       boolean includeTotalCount) {}

  /** nextPageToken is empty on the last page. */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record ListUsersCursorResponse(List<Row> users, String nextPageToken, boolean hasMore, Long totalCount) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SearchUsersRequest(String query, UserFilter filter, int pageSize, String pageToken, UserSort sort) {}

  public record SearchResult(Row user, double score) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SearchUsersResponse(List<SearchResult> results, String nextPageToken, boolean hasMore, long totalCount) {}

  /** @param limit 0 streams every matching user */
  public record StreamUsersRequest(UserFilter filter, UserSort sort, long limit) {}
}
