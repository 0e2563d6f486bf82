package io.intellixity.pagekit.error;

/**
 * Raised when a query references unknown fields or is otherwise structurally invalid.
 * <p>
 * Unknown-field checks only raise under the strict filter policy; malformed query documents always raise.
 */
public final class QueryValidationException extends PagingException {
  public static final String CODE = "VALIDATION_ERROR";

  public QueryValidationException(String message) {
    super(CODE, message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(CODE, message, cause);
  }
}
