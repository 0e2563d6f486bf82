package io.intellixity.pagekit.filter;

/** How the filter engine treats unknown fields and operator/type mismatches. */
public enum FilterPolicy {
  /** The offending predicate is false. */
  LENIENT,
  /** The whole request fails. */
  STRICT
}
