package io.intellixity.pagekit.examples.service;

import io.intellixity.pagekit.PagingEngine;
import io.intellixity.pagekit.page.PageWindow;
import io.intellixity.pagekit.query.Query;
import io.intellixity.pagekit.query.QueryStringTranslator;
import io.intellixity.pagekit.result.Connection;
import io.intellixity.pagekit.result.CursorListResult;
import io.intellixity.pagekit.result.OffsetPageResult;
import io.intellixity.pagekit.result.RankedList;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.search.SearchRequest;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

@Service
public final class UserService {
  /** Free-text parameter of the search endpoint; not a filter leaf. */
  public static final String SEARCH_TEXT = "q";

  private final UserDirectory directory;
  private final PagingEngine engine;
  private final QueryStringTranslator translator;

  public UserService(UserDirectory directory, PagingEngine engine, QueryStringTranslator translator) {
    this.directory = directory;
    this.engine = engine;
    this.translator = translator;
  }

  public Row get(String id) {
    return directory.find(id).orElseThrow(() -> new UserNotFoundException(id));
  }

  /** Offset listing; the envelope always reports totals. */
  public OffsetPageResult<Row> listOffset(Map<String, String> params) {
    Query q = translator.translate(params, QueryStringTranslator.Mode.OFFSET).withTotalCount(true);
    return engine.assembler().offsetPage(engine.paginate(directory.source(), q));
  }

  public CursorListResult<Row> listCursor(Map<String, String> params) {
    Query q = translator.translate(params, QueryStringTranslator.Mode.CURSOR);
    return engine.assembler().cursorList(engine.paginate(directory.source(), q));
  }

  /** Query-string search: {@code q} is the text, everything else follows the cursor listing rules. */
  public RankedList<Row> search(Map<String, String> params) {
    Map<String, String> rest = new HashMap<>(params == null ? Map.of() : params);
    String text = rest.remove(SEARCH_TEXT);
    Query q = translator.translate(rest, QueryStringTranslator.Mode.CURSOR);
    SearchRequest req = new SearchRequest(text, q.filter(), q.sort(), q.page(), q.includeTotalCount());
    return engine.assembler().rankedList(engine.search(directory.source(), req));
  }

  public Connection<Row> connection(Query query) {
    Query q = (query == null) ? new Query() : query;
    PageWindow window = engine.paginate(directory.source(), q);
    return engine.assembler().connection(window);
  }
}
