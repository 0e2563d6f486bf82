package io.intellixity.pagekit.search;

import java.util.List;
import java.util.Objects;

/**
 * A searchable text built from one or more row fields joined by a single space, e.g.
 * {@code fullName = firstName + " " + lastName}.
 *
 * @param exactWeight     added when the whole text equals the search text
 * @param substringWeight added when the text contains the search text (and is not an exact match)
 * @param prefixWeight    added when the text starts with the search text, independently of the above
 */
public record SearchField(String label, List<String> fields, int exactWeight, int substringWeight, int prefixWeight) {
  public SearchField {
    Objects.requireNonNull(label, "label");
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    if (fields.isEmpty()) throw new IllegalArgumentException("SearchField '" + label + "' has no fields");
    if (exactWeight < 0 || substringWeight < 0 || prefixWeight < 0) {
      throw new IllegalArgumentException("SearchField '" + label + "' has a negative weight");
    }
  }

  /** Single field with the {@link RelevanceWeights default weights}. */
  public static SearchField of(String field) {
    return new SearchField(field, List.of(field), RelevanceWeights.EXACT_MATCH, RelevanceWeights.SUBSTRING_MATCH,
        RelevanceWeights.PREFIX_MATCH);
  }

  public static SearchField composite(String label, String... fields) {
    return new SearchField(label, List.of(fields), RelevanceWeights.EXACT_MATCH, RelevanceWeights.SUBSTRING_MATCH,
        RelevanceWeights.PREFIX_MATCH);
  }

  /** Only contributes on a prefix match. */
  public static SearchField prefixOnly(String field, int weight) {
    return new SearchField(field, List.of(field), 0, 0, weight);
  }

  public SearchField withWeights(int exact, int substring, int prefix) {
    return new SearchField(label, fields, exact, substring, prefix);
  }
}
