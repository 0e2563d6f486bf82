package io.intellixity.pagekit.cursor;

import io.intellixity.pagekit.query.SortField;
import io.intellixity.pagekit.row.Row;

import java.util.*;

/**
 * Logical position of a record within an ordering: one entry per sort field, ending with the
 * {@link Row#ID id} tiebreaker.
 */
public record CursorKey(List<Entry> entries) {
  public CursorKey {
    entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    if (entries.isEmpty()) throw new IllegalArgumentException("CursorKey requires at least the id entry");
    if (!Row.ID.equals(entries.get(entries.size() - 1).field())) {
      throw new IllegalArgumentException("CursorKey must end with the id entry");
    }
  }

  public record Entry(String field, SortField.Direction direction, Object value) {
    public Entry {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(direction, "direction");
    }
  }

  public int size() { return entries.size(); }

  public Entry entry(int i) { return entries.get(i); }

  /** Value stored for the field, or null when absent. */
  public Object get(String field) {
    for (Entry e : entries) {
      if (e.field().equals(field)) return e.value();
    }
    return null;
  }

  public String id() { return String.valueOf(entries.get(entries.size() - 1).value()); }

  /** True when fields and directions line up one-to-one with {@code sortFields}. */
  public boolean matches(List<SortField> sortFields) {
    if (sortFields == null || sortFields.size() != entries.size()) return false;
    for (int i = 0; i < entries.size(); i++) {
      Entry e = entries.get(i);
      SortField sf = sortFields.get(i);
      if (!e.field().equals(sf.field()) || e.direction() != sf.direction()) return false;
    }
    return true;
  }
}
