package io.intellixity.pagekit.row;

import java.util.*;

/**
 * Thread-safe copy-on-write row collection.
 *
 * <p>Writers replace the backing list under a lock; readers get the current immutable list without
 * locking, so a snapshot never changes once taken.</p>
 */
public final class InMemoryRowSource implements RowSource {
  private final Object writeLock = new Object();
  private volatile List<Row> rows;

  public InMemoryRowSource() {
    this.rows = List.of();
  }

  public InMemoryRowSource(Collection<Row> initial) {
    this.rows = List.of();
    if (initial != null) {
      for (Row r : initial) add(r);
    }
  }

  @Override
  public List<Row> snapshot() { return rows; }

  public int size() { return rows.size(); }

  public Optional<Row> get(String id) {
    for (Row r : rows) {
      if (r.id().equals(id)) return Optional.of(r);
    }
    return Optional.empty();
  }

  /** Append a row; ids must be unique. */
  public void add(Row row) {
    Objects.requireNonNull(row, "row");
    synchronized (writeLock) {
      if (indexOf(rows, row.id()) >= 0) throw new IllegalArgumentException("Duplicate row id: " + row.id());
      List<Row> next = new ArrayList<>(rows.size() + 1);
      next.addAll(rows);
      next.add(row);
      rows = List.copyOf(next);
    }
  }

  /** Insert or replace (in place) by id. */
  public void put(Row row) {
    Objects.requireNonNull(row, "row");
    synchronized (writeLock) {
      List<Row> next = new ArrayList<>(rows);
      int i = indexOf(next, row.id());
      if (i >= 0) next.set(i, row);
      else next.add(row);
      rows = List.copyOf(next);
    }
  }

  public boolean remove(String id) {
    synchronized (writeLock) {
      int i = indexOf(rows, id);
      if (i < 0) return false;
      List<Row> next = new ArrayList<>(rows);
      next.remove(i);
      rows = List.copyOf(next);
      return true;
    }
  }

  private static int indexOf(List<Row> list, String id) {
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i).id().equals(id)) return i;
    }
    return -1;
  }
}
