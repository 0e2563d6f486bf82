package io.intellixity.pagekit.page;

import io.intellixity.pagekit.cursor.CursorCodec;
import io.intellixity.pagekit.cursor.CursorDecoding;
import io.intellixity.pagekit.cursor.CursorKey;
import io.intellixity.pagekit.cursor.JsonCursorCodec;
import io.intellixity.pagekit.error.CursorNotFoundException;
import io.intellixity.pagekit.error.MalformedCursorException;
import io.intellixity.pagekit.error.PageSizeOutOfRangeException;
import io.intellixity.pagekit.error.QueryValidationException;
import io.intellixity.pagekit.filter.FilterEngine;
import io.intellixity.pagekit.query.CursorPage;
import io.intellixity.pagekit.query.OffsetPage;
import io.intellixity.pagekit.query.Page;
import io.intellixity.pagekit.query.Query;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.row.RowSource;
import io.intellixity.pagekit.sort.SortEngine;
import io.intellixity.pagekit.sort.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Filter, sort and window a row snapshot for one page request.
 *
 * <p>Cursor pages locate their start by key value (binary search over the ordered set), never by position,
 * so rows inserted or deleted before the cursor do not shift the window. Offset pages are recomputed
 * against the filtered set on every call and do shift.</p>
 */
public final class PaginationController {
  private static final Logger log = LoggerFactory.getLogger(PaginationController.class);

  private final PagingConfig config;
  private final FilterEngine filters;
  private final SortEngine sorter;
  private final CursorCodec codec;

  public PaginationController() {
    this(PagingConfig.defaults());
  }

  public PaginationController(PagingConfig config) {
    this(config, new FilterEngine(config.filterOptions()), new SortEngine(), new JsonCursorCodec());
  }

  public PaginationController(PagingConfig config, FilterEngine filters, SortEngine sorter, CursorCodec codec) {
    this.config = Objects.requireNonNull(config, "config");
    this.filters = Objects.requireNonNull(filters, "filters");
    this.sorter = Objects.requireNonNull(sorter, "sorter");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  public PagingConfig config() { return config; }
  public CursorCodec codec() { return codec; }

  public PageWindow paginate(RowSource source, Query query) {
    Objects.requireNonNull(source, "source");
    return paginate(source.snapshot(), query);
  }

  public PageWindow paginate(Collection<Row> rows, Query query) {
    Objects.requireNonNull(rows, "rows");
    Query q = (query == null) ? new Query() : query;

    List<Row> snapshot = List.copyOf(rows);
    sorter.validate(q.sort(), config.filterOptions().schema());
    List<Row> filtered = filters.filter(snapshot, q.filter());
    SortSpec spec = SortSpec.of(q.sort());
    List<Row> ordered = sorter.orderedSequence(filtered, spec);

    PageWindow w = window(ordered, spec, q.page(), q.includeTotalCount());
    if (log.isDebugEnabled()) {
      log.debug("pagekit.paginate mode={} snapshot={} filtered={} window={} hasNext={} hasPrevious={} sort={}",
          w.mode(), snapshot.size(), ordered.size(), w.items().size(), w.hasNext(), w.hasPrevious(), spec.fields());
    }
    return w;
  }

  /**
   * Window an already filtered and ordered sequence. {@code ordered} must be sorted under {@code spec}.
   * A null page is a forward cursor page from the start with the default size.
   */
  public PageWindow window(List<Row> ordered, SortSpec spec, Page page, boolean includeTotalCount) {
    Objects.requireNonNull(ordered, "ordered");
    Objects.requireNonNull(spec, "spec");
    Page p = (page == null) ? CursorPage.first(null) : page;
    int size = resolvePageSize(p.pageSize());

    if (p instanceof OffsetPage op) return offsetWindow(ordered, spec, op, size, includeTotalCount);
    if (p instanceof CursorPage cp) {
      return (cp.direction() == CursorPage.Direction.BACKWARD)
          ? backwardWindow(ordered, spec, cp, size, includeTotalCount)
          : forwardWindow(ordered, spec, cp, size, includeTotalCount);
    }
    throw new QueryValidationException("Unsupported page type: " + p.getClass().getName());
  }

  /** Apply the configured bounds to a requested size; null means the default. */
  public int resolvePageSize(Integer requested) {
    if (requested == null) return config.defaultPageSize();
    int max = config.maxPageSize();
    if (requested >= 1 && requested <= max) return requested;
    if (config.pageSizePolicy() == PageSizePolicy.REJECT) throw new PageSizeOutOfRangeException(requested, max);
    return Math.max(1, Math.min(max, requested));
  }

  private PageWindow offsetWindow(List<Row> s, SortSpec spec, OffsetPage op, int size, boolean includeTotal) {
    int n = s.size();
    int page = Math.max(1, op.page());
    long offset = (page - 1L) * size;
    int from = (int) Math.min(n, offset);
    int to = Math.min(n, from + size);
    boolean hasNext = (long) page * size < n;
    Long total = includeTotal ? (long) n : null;
    Integer totalPages = includeTotal ? (n + size - 1) / size : null;
    return new PageWindow(PageWindow.Mode.OFFSET, s.subList(from, to), page, size, hasNext, page > 1,
        total, totalPages, spec, codec);
  }

  private PageWindow forwardWindow(List<Row> s, SortSpec spec, CursorPage cp, int size, boolean includeTotal) {
    int n = s.size();
    int start = 0;
    CursorKey key = resolveCursor(cp.cursor(), spec);
    if (key != null) {
      start = firstIndex(s, key, spec, false);
      boolean found = start > 0 && sorter.compareRowToKey(s.get(start - 1), key, spec) == 0;
      if (!found) recoverMissing(key);
    }
    // one extra row tells whether another page follows
    int lookAheadEnd = (int) Math.min(n, (long) start + size + 1);
    boolean hasNext = lookAheadEnd - start > size;
    int end = Math.min(lookAheadEnd, start + size);
    return new PageWindow(PageWindow.Mode.FORWARD, s.subList(start, end), null, size, hasNext, start > 0,
        includeTotal ? (long) n : null, null, spec, codec);
  }

  private PageWindow backwardWindow(List<Row> s, SortSpec spec, CursorPage cp, int size, boolean includeTotal) {
    int n = s.size();
    int end = n;
    CursorKey key = resolveCursor(cp.cursor(), spec);
    if (key != null) {
      end = firstIndex(s, key, spec, true);
      boolean found = end < n && sorter.compareRowToKey(s.get(end), key, spec) == 0;
      if (!found) recoverMissing(key);
    }
    int from = Math.max(0, end - size);
    return new PageWindow(PageWindow.Mode.BACKWARD, s.subList(from, end), null, size, end < n, from > 0,
        includeTotal ? (long) n : null, null, spec, codec);
  }

  /** Decoded key, or null to start from the edge of the set. */
  private CursorKey resolveCursor(String token, SortSpec spec) {
    if (token == null) return null;
    CursorDecoding decoding = codec.decode(token);
    if (decoding instanceof CursorDecoding.Malformed m) {
      throw new MalformedCursorException(m.reason());
    }
    CursorKey key = ((CursorDecoding.Decoded) decoding).key();
    if (key.matches(spec.fields())) return key;

    if (config.cursorRecovery() == CursorRecovery.STRICT) {
      throw new CursorNotFoundException("Cursor was issued for a different sort order");
    }
    if (log.isDebugEnabled()) {
      log.debug("pagekit.cursor incompatible key={} sort={}; starting from the edge", key.entries(), spec.fields());
    }
    return null;
  }

  private void recoverMissing(CursorKey key) {
    if (config.cursorRecovery() == CursorRecovery.STRICT) {
      throw new CursorNotFoundException("Record for cursor no longer exists: id=" + key.id());
    }
    log.debug("pagekit.cursor target id={} missing; resuming at nearest successor", key.id());
  }

  /**
   * Lowest index whose row key is greater than {@code key} ({@code inclusive=false}) or greater than or
   * equal to it ({@code inclusive=true}); {@code s.size()} when there is none.
   */
  private int firstIndex(List<Row> s, CursorKey key, SortSpec spec, boolean inclusive) {
    int lo = 0;
    int hi = s.size();
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      int c = sorter.compareRowToKey(s.get(mid), key, spec);
      boolean after = inclusive ? c >= 0 : c > 0;
      if (after) hi = mid;
      else lo = mid + 1;
    }
    return lo;
  }
}
