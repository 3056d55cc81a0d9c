package com.flamingo.ai.mentions.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(BatchProcessingException.class)
  public ResponseEntity<ApiError> handleBatchProcessing(
      BatchProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("batch_processing");
    String errorId = generateErrorId();
    log.warn("Batch rejected [{}]: batch={}, {}", errorId, ex.getBatchId(), ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.BATCH_INVALID,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(ArchiveProcessingException.class)
  public ResponseEntity<ApiError> handleArchive(
      ArchiveProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("archive_unreadable");
    String errorId = generateErrorId();
    log.error("Archive error [{}]: {} ({})", errorId, ex.getMessage(), ex.getFile(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.ARCHIVE_UNREADABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;
    return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(ForumApiException.class)
  public ResponseEntity<ApiError> handleForumApi(ForumApiException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "forum_rate_limited" : "forum_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("Forum API error [{}]: status={}, {}", errorId, ex.getStatusCode(), ex.getMessage());

    String code = ex.isRateLimited() ? ApiError.FORUM_RATE_LIMITED : ApiError.FORUM_UNAVAILABLE;
    return build(HttpStatus.BAD_GATEWAY, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);
    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiError> handleConstraintViolation(
      ConstraintViolationException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getConstraintViolations().stream()
            .findFirst()
            .map(violation -> violation.getMessage())
            .orElse("Validation failed");

    log.warn("Constraint violation [{}]: {}", errorId, message);
    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
