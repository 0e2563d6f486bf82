package io.intellixity.pagekit.examples.web;

import io.intellixity.pagekit.error.PagingException;
import io.intellixity.pagekit.error.QueryValidationException;
import io.intellixity.pagekit.examples.service.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Uniform {@code {"success":false,"error":{"code","message"}}} bodies for every endpoint. */
@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  public record ErrorBody(String code, String message) {}

  public record ErrorResponse(boolean success, ErrorBody error) {
    static ErrorResponse of(String code, String message) {
      return new ErrorResponse(false, new ErrorBody(code, message));
    }
  }

  @ExceptionHandler(PagingException.class)
  public ResponseEntity<ErrorResponse> handlePaging(PagingException ex) {
    log.warn("Rejected request [{}]: {}", ex.code(), ex.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of(ex.code(), ex.getMessage()));
  }

  /** Query JSON errors arrive wrapped by the message converter. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    for (Throwable t = ex; t != null; t = t.getCause()) {
      if (t instanceof PagingException p) return handlePaging(p);
    }
    log.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of(QueryValidationException.CODE, "Malformed request body"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Bad request: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of(QueryValidationException.CODE, ex.getMessage()));
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleUserNotFound(UserNotFoundException ex) {
    log.warn("User not found: {}", ex.userId());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.code(), ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unexpected error: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("INTERNAL_ERROR", "An unexpected error occurred"));
  }
}
