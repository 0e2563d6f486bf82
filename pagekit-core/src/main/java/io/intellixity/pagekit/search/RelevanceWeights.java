package io.intellixity.pagekit.search;

/**
 * Default relevance weights. An exact full-field match outranks a substring match, which outranks a
 * prefix match on a component field; rows scoring zero are dropped from the results.
 */
public final class RelevanceWeights {
  private RelevanceWeights() {}

  public static final int EXACT_MATCH = 100;
  public static final int SUBSTRING_MATCH = 40;
  public static final int PREFIX_MATCH = 20;

  /** Score given to every row when the search text is blank. */
  public static final int BLANK_QUERY_SCORE = 1;
}
