package io.intellixity.pagekit.page;

import io.intellixity.pagekit.cursor.CursorCodec;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.sort.SortSpec;

import java.util.List;
import java.util.Objects;

/**
 * One page of the ordered, filtered sequence plus navigation metadata.
 *
 * @param page       1-based page number in offset mode, null in cursor modes
 * @param totalCount size of the filtered set, only when requested
 * @param totalPages offset mode only, only when the total was requested
 */
public record PageWindow(Mode mode,
                         List<Row> items,
                         Integer page,
                         int pageSize,
                         boolean hasNext,
                         boolean hasPrevious,
                         Long totalCount,
                         Integer totalPages,
                         SortSpec sort,
                         CursorCodec codec) {
  public PageWindow {
    Objects.requireNonNull(mode, "mode");
    items = List.copyOf(Objects.requireNonNull(items, "items"));
    Objects.requireNonNull(sort, "sort");
    Objects.requireNonNull(codec, "codec");
  }

  public enum Mode { OFFSET, FORWARD, BACKWARD }

  public boolean isEmpty() { return items.isEmpty(); }

  /** Encoded key of {@code row} under this window's sort. */
  public String cursorFor(Row row) {
    return codec.encode(sort.keyOf(row));
  }

  public String startCursor() { return items.isEmpty() ? null : cursorFor(items.get(0)); }

  public String endCursor() { return items.isEmpty() ? null : cursorFor(items.get(items.size() - 1)); }
}
