package io.intellixity.pagekit.error;

/**
 * Base type for client-facing engine failures. {@link #code()} is stable and safe to put on the wire.
 */
public abstract class PagingException extends RuntimeException {
  private final String code;

  protected PagingException(String code, String message) {
    super(message);
    this.code = code;
  }

  protected PagingException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String code() { return code; }
}
