package io.intellixity.pagekit.error;

/** The cursor token could not be decoded. */
public final class MalformedCursorException extends PagingException {
  public static final String CODE = "INVALID_CURSOR";

  public MalformedCursorException(String reason) {
    super(CODE, "Invalid or expired cursor: " + reason);
  }
}
