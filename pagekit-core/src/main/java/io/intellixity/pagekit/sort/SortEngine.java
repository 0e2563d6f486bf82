package io.intellixity.pagekit.sort;

import io.intellixity.pagekit.cursor.CursorKey;
import io.intellixity.pagekit.error.QueryValidationException;
import io.intellixity.pagekit.query.SortField;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.row.RowSchema;
import io.intellixity.pagekit.row.Values;

import java.util.*;

/**
 * Deterministic total ordering of rows under a {@link SortSpec}.
 *
 * <p>Values order by {@link Values#compareTotal(Object, Object)}: null before any value, so nulls come
 * first ascending and last descending. Ids use {@link Values#compareIds(String, String)}. Because the
 * spec ends with the unique id, two rows compare equal only when they are the same record.</p>
 */
public final class SortEngine {

  public int compare(Row a, Row b, SortSpec spec) {
    Objects.requireNonNull(spec, "spec");
    for (SortField sf : spec.fields()) {
      int c = compareValues(sf.field(), a.get(sf.field()), b.get(sf.field()));
      if (c != 0) return sf.direction() == SortField.Direction.DESC ? -c : c;
    }
    return 0;
  }

  public Comparator<Row> comparator(SortSpec spec) {
    Objects.requireNonNull(spec, "spec");
    return (a, b) -> compare(a, b, spec);
  }

  /** New immutable list in sort order; the input is not touched. */
  public List<Row> orderedSequence(Collection<Row> rows, SortSpec spec) {
    Objects.requireNonNull(rows, "rows");
    List<Row> out = new ArrayList<>(rows);
    out.sort(comparator(spec));
    return Collections.unmodifiableList(out);
  }

  public CursorKey keyOf(Row row, SortSpec spec) {
    return spec.keyOf(row);
  }

  /** Position of {@code row} relative to a key taken under the same spec. */
  public int compareRowToKey(Row row, CursorKey key, SortSpec spec) {
    requireCompatible(key, spec);
    List<SortField> fields = spec.fields();
    for (int i = 0; i < fields.size(); i++) {
      SortField sf = fields.get(i);
      int c = compareValues(sf.field(), row.get(sf.field()), key.entry(i).value());
      if (c != 0) return sf.direction() == SortField.Direction.DESC ? -c : c;
    }
    return 0;
  }

  public int compareKeys(CursorKey a, CursorKey b, SortSpec spec) {
    requireCompatible(a, spec);
    requireCompatible(b, spec);
    List<SortField> fields = spec.fields();
    for (int i = 0; i < fields.size(); i++) {
      int c = compareValues(fields.get(i).field(), a.entry(i).value(), b.entry(i).value());
      if (c != 0) return fields.get(i).direction() == SortField.Direction.DESC ? -c : c;
    }
    return 0;
  }

  /** Rejects sort fields the schema does not declare; a null schema accepts everything. */
  public void validate(List<SortField> sort, RowSchema schema) {
    if (sort == null || schema == null) return;
    for (SortField sf : sort) {
      if (sf == null) continue;
      if (sf.field().isBlank()) throw new QueryValidationException("Blank field in sort");
      if (!schema.has(sf.field())) throw new QueryValidationException("Unknown field '" + sf.field() + "' in sort");
    }
  }

  private static int compareValues(String field, Object a, Object b) {
    if (Row.ID.equals(field) && a instanceof String x && b instanceof String y) return Values.compareIds(x, y);
    return Values.compareTotal(a, b);
  }

  private static void requireCompatible(CursorKey key, SortSpec spec) {
    Objects.requireNonNull(key, "key");
    if (!key.matches(spec.fields())) {
      throw new IllegalArgumentException("Cursor key " + key + " was not taken under " + spec);
    }
  }
}
