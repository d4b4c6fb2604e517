package com.flamingo.ai.argumentation.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
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

  @ExceptionHandler(MisalignedSequenceException.class)
  public ResponseEntity<ApiError> handleMisalignedSequence(
      MisalignedSequenceException ex, HttpServletRequest request) {

    incrementErrorCounter("misaligned_sequence");
    String errorId = generateErrorId();
    log.warn(
        "Misaligned tag sequence [{}]: expected={}, actual={}",
        errorId,
        ex.getExpected(),
        ex.getActual());

    return unprocessable(errorId, ex, request);
  }

  @ExceptionHandler(InvalidLabelSequenceException.class)
  public ResponseEntity<ApiError> handleInvalidLabelSequence(
      InvalidLabelSequenceException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_label_sequence");
    String errorId = generateErrorId();
    log.warn("Invalid label sequence [{}]: {}", errorId, ex.getMessage());

    return unprocessable(errorId, ex, request);
  }

  @ExceptionHandler(InvalidComponentException.class)
  public ResponseEntity<ApiError> handleInvalidComponent(
      InvalidComponentException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_component");
    String errorId = generateErrorId();
    log.warn("Invalid component [{}]: {}", errorId, ex.getMessage());

    return unprocessable(errorId, ex, request);
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

    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private ResponseEntity<ApiError> unprocessable(
      String errorId, ArgumentAnalysisException ex, HttpServletRequest request) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ex.getErrorCode())
                .message(ex.getMessage())
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
