package io.intellixity.pagekit.query;

/** Numbered page; {@code page} is 1-based. */
public record OffsetPage(int page, Integer pageSize) implements Page {
  public static OffsetPage of(int page, int pageSize) { return new OffsetPage(page, pageSize); }
}
