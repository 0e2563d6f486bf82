package io.intellixity.pagekit.error;

/** Raised instead of clamping when the embedding application rejects out-of-range page sizes. */
public final class PageSizeOutOfRangeException extends PagingException {
  public static final String CODE = "PAGE_SIZE_OUT_OF_RANGE";

  private final int requested;
  private final int max;

  public PageSizeOutOfRangeException(int requested, int max) {
    super(CODE, "Page size " + requested + " is outside [1, " + max + "]");
    this.requested = requested;
    this.max = max;
  }

  public int requested() { return requested; }
  public int max() { return max; }
}
