package io.intellixity.pagekit.examples.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.intellixity.pagekit.examples.service.UserService;
import io.intellixity.pagekit.query.QueryStringTranslator;
import io.intellixity.pagekit.result.CursorListResult;
import io.intellixity.pagekit.result.OffsetPageResult;
import io.intellixity.pagekit.result.RankedList;
import io.intellixity.pagekit.row.Row;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Map;

/** Query-string surface: {@code ?page=2&limit=10&status=ACTIVE&age_gte=30&sort=-createdAt}. */
@RestController
@RequestMapping(UserController.BASE)
public final class UserController {
  static final String BASE = "/api/v1/users";

  private final UserService users;

  public UserController(UserService users) {
    this.users = users;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record OffsetPagination(int page, int limit, Long totalCount, Integer totalPages, boolean hasNextPage,
                                 boolean hasPreviousPage) {}

  public record OffsetEnvelope(boolean success, List<Row> data, OffsetPagination pagination) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record CursorPagination(int limit, boolean hasMore, boolean hasPrevious, Long totalCount) {}

  public record Cursors(String next, String prev) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Links(String self, String next, String prev) {}

  public record CursorEnvelope(boolean success, List<Row> data, CursorPagination pagination, Cursors cursors,
                               Links links) {}

  public record DataEnvelope<T>(boolean success, T data) {}

  @GetMapping
  public OffsetEnvelope list(@RequestParam Map<String, String> params) {
    OffsetPageResult<Row> r = users.listOffset(params);
    return new OffsetEnvelope(true, r.items(), new OffsetPagination(r.page(), r.pageSize(), r.totalCount(),
        r.totalPages(), r.hasNext(), r.hasPrevious()));
  }

  @GetMapping("/cursor")
  public CursorEnvelope cursor(@RequestParam Map<String, String> params) {
    CursorListResult<Row> r = users.listCursor(params);
    Links links = new Links(
        link("/cursor", params, r.limit(), params.get(QueryStringTranslator.CURSOR), params.get(QueryStringTranslator.DIRECTION)),
        r.nextCursor() == null ? null : link("/cursor", params, r.limit(), r.nextCursor(), null),
        r.prevCursor() == null ? null : link("/cursor", params, r.limit(), r.prevCursor(), "backward"));
    return new CursorEnvelope(true, r.data(),
        new CursorPagination(r.limit(), r.hasMore(), r.hasPrevious(), r.totalCount()),
        new Cursors(r.nextCursor(), r.prevCursor()), links);
  }

  @GetMapping("/search")
  public DataEnvelope<RankedList<Row>> search(@RequestParam Map<String, String> params) {
    return new DataEnvelope<>(true, users.search(params));
  }

  @GetMapping("/{id}")
  public DataEnvelope<Row> get(@PathVariable("id") String id) {
    return new DataEnvelope<>(true, users.get(id));
  }

  /** Same filters and sort as the current request, with a different position. */
  static String link(String path, Map<String, String> params, int limit, String cursor, String direction) {
    UriComponentsBuilder b = UriComponentsBuilder.fromPath(BASE + path);
    for (var e : params.entrySet()) {
      String k = e.getKey();
      if (QueryStringTranslator.LIMIT.equals(k) || QueryStringTranslator.CURSOR.equals(k)
          || QueryStringTranslator.DIRECTION.equals(k)) continue;
      b.queryParam(k, e.getValue());
    }
    b.queryParam(QueryStringTranslator.LIMIT, limit);
    if (cursor != null && !cursor.isBlank()) b.queryParam(QueryStringTranslator.CURSOR, cursor);
    if (direction != null && !direction.isBlank()) b.queryParam(QueryStringTranslator.DIRECTION, direction);
    return b.encode().build().toUriString();
  }
}
