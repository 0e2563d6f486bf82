package io.intellixity.pagekit.page;

/** Handling of requested page sizes outside {@code [1, maxPageSize]}. */
public enum PageSizePolicy {
  /** Clamp to the nearest bound. */
  CLAMP,
  /** Raise {@link io.intellixity.pagekit.error.PageSizeOutOfRangeException}. */
  REJECT
}
