package io.intellixity.pagekit.sort;

import io.intellixity.pagekit.cursor.CursorKey;
import io.intellixity.pagekit.query.SortField;
import io.intellixity.pagekit.row.Row;

import java.util.*;

/**
 * Ordered sort fields that always end with the {@link Row#ID id} tiebreaker.
 *
 * <p>An explicit {@code id} field ends the key (fields after it can never decide) and keeps its requested
 * direction; otherwise {@code id ASC} is appended. Repeated fields keep their first occurrence.</p>
 */
public final class SortSpec {
  private static final SortSpec BY_ID = new SortSpec(List.of(SortField.asc(Row.ID)));

  private final List<SortField> fields;

  private SortSpec(List<SortField> fields) {
    if (fields.isEmpty() || !Row.ID.equals(fields.get(fields.size() - 1).field())) {
      throw new IllegalStateException("Sort order without an id tiebreaker: " + fields);
    }
    this.fields = List.copyOf(fields);
  }

  public static SortSpec byId() { return BY_ID; }

  public static SortSpec of(SortField... requested) { return of(List.of(requested)); }

  public static SortSpec of(List<SortField> requested) {
    if (requested == null || requested.isEmpty()) return BY_ID;
    List<SortField> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (SortField sf : requested) {
      if (sf == null || !seen.add(sf.field())) continue;
      out.add(sf);
      if (Row.ID.equals(sf.field())) break;
    }
    if (out.isEmpty() || !Row.ID.equals(out.get(out.size() - 1).field())) {
      out.add(SortField.asc(Row.ID));
    }
    return new SortSpec(out);
  }

  /** All fields including the tiebreaker. */
  public List<SortField> fields() { return fields; }

  public SortField tiebreaker() { return fields.get(fields.size() - 1); }

  /** Fields before the tiebreaker. */
  public List<SortField> leading() { return fields.subList(0, fields.size() - 1); }

  public CursorKey keyOf(Row row) {
    Objects.requireNonNull(row, "row");
    List<CursorKey.Entry> entries = new ArrayList<>(fields.size());
    for (SortField sf : fields) {
      entries.add(new CursorKey.Entry(sf.field(), sf.direction(), row.get(sf.field())));
    }
    return new CursorKey(entries);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof SortSpec s && fields.equals(s.fields));
  }

  @Override
  public int hashCode() { return fields.hashCode(); }

  @Override
  public String toString() { return "SortSpec" + fields; }
}
