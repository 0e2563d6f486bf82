package io.intellixity.pagekit.search;

import io.intellixity.pagekit.row.Row;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Case-insensitive weighted text scoring over a fixed set of {@link SearchField}s. */
public final class RelevanceScorer {
  private final List<SearchField> fields;

  public RelevanceScorer(List<SearchField> fields) {
    this.fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    if (this.fields.isEmpty()) throw new IllegalArgumentException("At least one search field is required");
  }

  public List<SearchField> fields() { return fields; }

  /** Zero means no match; a blank search text scores {@link RelevanceWeights#BLANK_QUERY_SCORE}. */
  public double score(Row row, String text) {
    Objects.requireNonNull(row, "row");
    if (text == null || text.isBlank()) return RelevanceWeights.BLANK_QUERY_SCORE;
    String q = text.trim().toLowerCase(Locale.ROOT);

    double score = 0;
    for (SearchField f : fields) {
      String value = textOf(row, f);
      if (value == null) continue;
      if (f.exactWeight() > 0 && value.equals(q)) score += f.exactWeight();
      else if (f.substringWeight() > 0 && value.contains(q)) score += f.substringWeight();
      if (f.prefixWeight() > 0 && value.startsWith(q)) score += f.prefixWeight();
    }
    return score;
  }

  private static String textOf(Row row, SearchField f) {
    StringBuilder sb = new StringBuilder();
    for (String name : f.fields()) {
      Object v = row.get(name);
      if (v == null) continue;
      if (sb.length() > 0) sb.append(' ');
      sb.append(v);
    }
    return (sb.length() == 0) ? null : sb.toString().toLowerCase(Locale.ROOT);
  }
}
