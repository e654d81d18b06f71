package com.scholary.audiobook.enhancer.api;

import com.scholary.audiobook.enhancer.annotation.AnnotationException;
import com.scholary.audiobook.enhancer.segment.SegmentationException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to HTTP responses: malformed or invalid requests to 400, documents the engine
 * cannot process to 422.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    LOGGER.warn("Invalid enhancement request: {}", details);
    return error(HttpStatus.BAD_REQUEST, "InvalidRequest", details);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable enhancement request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Request body is not valid JSON");
  }

  @ExceptionHandler({AnnotationException.class, SegmentationException.class})
  public ResponseEntity<ApiError> handleUnprocessable(RuntimeException ex) {
    LOGGER.error("Document could not be enhanced: {}", ex.getMessage());
    return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getClass().getSimpleName(), ex.getMessage());
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String code, String details) {
    return ResponseEntity.status(status)
        .body(new ApiError(code, status.getReasonPhrase(), details, Instant.now()));
  }

  /** Error body returned to API clients. */
  public record ApiError(String errorCode, String message, String details, Instant timestamp) {}
}
