package io.intellixity.pagekit.row;

import java.util.Collection;
import java.util.List;

/**
 * Ordered-iteration collaborator supplying the candidate rows.
 *
 * <p>{@link #snapshot()} must return an immutable list that does not change while a single
 * pagination call works on it.</p>
 */
@FunctionalInterface
public interface RowSource {
  List<Row> snapshot();

  static RowSource of(Collection<Row> rows) {
    List<Row> copy = List.copyOf(rows);
    return () -> copy;
  }
}
