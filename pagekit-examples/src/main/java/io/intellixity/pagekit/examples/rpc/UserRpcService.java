package io.intellixity.pagekit.examples.rpc;

import io.intellixity.pagekit.PagingEngine;
import io.intellixity.pagekit.examples.rpc.UserRpc.*;
import io.intellixity.pagekit.examples.service.UserDirectory;
import io.intellixity.pagekit.examples.service.UserNotFoundException;
import io.intellixity.pagekit.page.PageWindow;
import io.intellixity.pagekit.query.CursorPage;
import io.intellixity.pagekit.query.OffsetPage;
import io.intellixity.pagekit.query.Query;
import io.intellixity.pagekit.query.QueryElement;
import io.intellixity.pagekit.result.RankedList;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.search.SearchRequest;
import io.intellixity.pagekit.stream.CancellationSignal;
import io.intellixity.pagekit.stream.StreamSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/** Maps the enumerated RPC messages onto the canonical filter, sort and page triple. */
@Service
public final class UserRpcService {
  private static final Logger log = LoggerFactory.getLogger(UserRpcService.class);

  private final UserDirectory directory;
  private final PagingEngine engine;

  public UserRpcService(UserDirectory directory, PagingEngine engine) {
    this.directory = directory;
    this.engine = engine;
  }

  public Row getUser(GetUserRequest req) {
    if (req == null || req.id() == null || req.id().isBlank()) throw new IllegalArgumentException("id is required");
    return directory.find(req.id()).orElseThrow(() -> new UserNotFoundException(req.id()));
  }

  public ListUsersOffsetResponse listUsersOffset(ListUsersOffsetRequest req) {
    ListUsersOffsetRequest r = (req == null) ? new ListUsersOffsetRequest(0, 1, null, null) : req;
    Query q = new Query()
        .withFilter(filterOf(r.filter()))
        .withSort(UserSort.toSortFields(r.sort()))
        .withPage(new OffsetPage(Math.max(1, r.pageNumber()), pageSize(r.pageSize())))
        .withTotalCount(true);
    PageWindow w = engine.paginate(directory.source(), q);
    return new ListUsersOffsetResponse(w.items(), w.totalCount(), w.totalPages(), w.page(), w.hasNext(),
        w.hasPrevious());
  }

  public ListUsersCursorResponse listUsersCursor(ListUsersCursorRequest req) {
    ListUsersCursorRequest r = (req == null) ? new ListUsersCursorRequest(0, null, null, null, true) : req;
    Query q = new Query()
        .withFilter(filterOf(r.filter()))
        .withSort(UserSort.toSortFields(r.sort()))
        .withPage(CursorPage.after(r.pageToken(), pageSize(r.pageSize())))
        .withTotalCount(r.includeTotalCount());
    PageWindow w = engine.paginate(directory.source(), q);
    String next = w.hasNext() ? w.endCursor() : "";
    return new ListUsersCursorResponse(w.items(), next, w.hasNext(), w.totalCount());
  }

  public SearchUsersResponse searchUsers(SearchUsersRequest req) {
    SearchUsersRequest r = (req == null) ? new SearchUsersRequest(null, null, 0, null, null) : req;
    SearchRequest search = new SearchRequest(r.query(), filterOf(r.filter()), UserSort.toSortFields(r.sort()),
        CursorPage.after(r.pageToken(), pageSize(r.pageSize())), true);
    RankedList<Row> ranked = engine.assembler().rankedList(engine.search(directory.source(), search));

    List<SearchResult> results = new ArrayList<>(ranked.results().size());
    for (RankedList.ScoredItem<Row> item : ranked.results()) {
      results.add(new SearchResult(item.node(), item.score()));
    }
    String next = (ranked.nextCursor() == null) ? "" : ranked.nextCursor();
    long total = (ranked.totalCount() == null) ? results.size() : ranked.totalCount();
    return new SearchUsersResponse(results, next, ranked.hasMore(), total);
  }

  /** Writes matching users to {@code sink} in order until exhausted, limited or cancelled. */
  public StreamSummary streamUsers(StreamUsersRequest req, CancellationSignal signal, Consumer<? super Row> sink) {
    StreamUsersRequest r = (req == null) ? new StreamUsersRequest(null, null, 0) : req;
    StreamSummary summary = engine.stream(directory.source(), filterOf(r.filter()), UserSort.toSortFields(r.sort()),
        r.limit(), signal, sink);
    if (summary.cancelled()) log.info("StreamUsers cancelled by client after {} users", summary.emitted());
    return summary;
  }

  private static QueryElement filterOf(UserFilter filter) {
    return (filter == null) ? null : filter.toElement();
  }

  // proto3 default 0 means unset
  private static Integer pageSize(int requested) {
    return (requested <= 0) ? null : requested;
  }
}
