package io.intellixity.pagekit.examples.web;

import io.intellixity.pagekit.error.MalformedCursorException;
import io.intellixity.pagekit.error.PageSizeOutOfRangeException;
import io.intellixity.pagekit.error.QueryValidationException;
import io.intellixity.pagekit.examples.service.UserNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

final class GlobalExceptionHandlerTest {
  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

  private static final HttpInputMessage EMPTY_BODY = new HttpInputMessage() {
    @Override
    public InputStream getBody() { return new ByteArrayInputStream(new byte[0]); }

    @Override
    public HttpHeaders getHeaders() { return new HttpHeaders(); }
  };

  @Test
  void pagingErrorsAreBadRequests() {
    ResponseEntity<GlobalExceptionHandler.ErrorResponse> r = handler.handlePaging(new MalformedCursorException("not json"));
    assertEquals(400, r.getStatusCode().value());
    assertFalse(r.getBody().success());
    assertEquals("INVALID_CURSOR", r.getBody().error().code());

    r = handler.handlePaging(new PageSizeOutOfRangeException(500, 100));
    assertEquals("PAGE_SIZE_OUT_OF_RANGE", r.getBody().error().code());
  }

  @Test
  void unwrapsQueryErrorsFromTheMessageConverter() {
    HttpMessageNotReadableException wrapped = new HttpMessageNotReadableException("JSON parse error",
        new RuntimeException(new QueryValidationException("Unknown operator 'like'")), EMPTY_BODY);

    ResponseEntity<GlobalExceptionHandler.ErrorResponse> r = handler.handleUnreadable(wrapped);
    assertEquals(400, r.getStatusCode().value());
    assertEquals("VALIDATION_ERROR", r.getBody().error().code());
    assertEquals("Unknown operator 'like'", r.getBody().error().message());

    ResponseEntity<GlobalExceptionHandler.ErrorResponse> plain =
        handler.handleUnreadable(new HttpMessageNotReadableException("eof", EMPTY_BODY));
    assertEquals("Malformed request body", plain.getBody().error().message());
  }

  @Test
  void notFoundAndUnexpected() {
    ResponseEntity<GlobalExceptionHandler.ErrorResponse> r = handler.handleUserNotFound(new UserNotFoundException("9"));
    assertEquals(404, r.getStatusCode().value());
    assertEquals("NOT_FOUND", r.getBody().error().code());

    ResponseEntity<GlobalExceptionHandler.ErrorResponse> boom = handler.handleGeneric(new IllegalStateException("boom"));
    assertEquals(500, boom.getStatusCode().value());
    assertEquals("INTERNAL_ERROR", boom.getBody().error().code());
  }
}
