package com.aoimapper.analyzer.api;

import com.aoimapper.analyzer.pipeline.AnalysisErrorKind;
import com.aoimapper.analyzer.pipeline.AnalysisException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Centralized REST exception mapping for the analysis API.
 *
 * <p>Pipeline failure kinds are converted into stable JSON error payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  /**
   * Maps pipeline failures by kind: validation to 400, missing imagery to 404, timeout to 504,
   * internal errors to 500.
   *
   * @param ex pipeline failure
   * @return standardized error payload
   */
  @ExceptionHandler(AnalysisException.class)
  public ResponseEntity<Map<String, Object>> handleAnalysis(AnalysisException ex) {
    AnalysisErrorKind kind = ex.kind();
    return ResponseEntity.status(statusOf(kind)).body(error(kind.code(), ex.getMessage()));
  }

  /**
   * Maps unreadable JSON bodies to HTTP 400.
   *
   * @param ex body conversion failure
   * @return standardized error payload
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest()
        .body(error(AnalysisErrorKind.VALIDATION.code(), "malformed request body"));
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMediaType(HttpMediaTypeNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
        .body(error("unsupported_media_type", "request body must be application/json"));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethod(HttpRequestMethodNotSupportedException ex) {
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
        .body(error("method_not_allowed", "method " + ex.getMethod() + " not allowed"));
  }

  /**
   * Maps unmatched routes to HTTP 404 instead of generic 500.
   *
   * @param ex Spring MVC no-resource/no-handler exception
   * @return standardized not-found payload
   */
  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(error("not_found", "resource not found"));
  }

  /**
   * Maps unexpected failures to HTTP 500.
   *
   * @param ex unhandled server-side exception
   * @return standardized error payload
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled API failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error(AnalysisErrorKind.INTERNAL.code(), "internal server error"));
  }

  static HttpStatus statusOf(AnalysisErrorKind kind) {
    return switch (kind) {
      case VALIDATION -> HttpStatus.BAD_REQUEST;
      case DATA_UNAVAILABLE -> HttpStatus.NOT_FOUND;
      case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
      case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }

  private Map<String, Object> error(String code, String message) {
    return Map.of(
        "error", code,
        "message", message == null ? "" : message,
        "timestamp", Instant.now().toString());
  }
}
