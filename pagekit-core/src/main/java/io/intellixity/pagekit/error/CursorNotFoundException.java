package io.intellixity.pagekit.error;

/** Raised under strict cursor recovery when the cursor's record is gone or the cursor belongs to another ordering. */
public final class CursorNotFoundException extends PagingException {
  public static final String CODE = "CURSOR_NOT_FOUND";

  public CursorNotFoundException(String message) {
    super(CODE, message);
  }
}
