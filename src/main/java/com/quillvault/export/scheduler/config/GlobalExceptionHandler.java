package com.quillvault.export.scheduler.config;

import com.quillvault.export.scheduler.exception.ExecutionRejectedException;
import com.quillvault.export.scheduler.exception.RateLimitExceededException;
import com.quillvault.export.scheduler.exception.ScheduleConflictException;
import com.quillvault.export.scheduler.exception.ScheduleNotFoundException;
import com.quillvault.export.scheduler.exception.StoreUnavailableException;
import com.quillvault.export.scheduler.exception.UnauthorizedException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@ControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final Clock clock;

  public GlobalExceptionHandler(Clock clock) {
    this.clock = clock;
  }

  /** Bean Validation failures on request bodies. */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
    log.warn("Validation failed for request: {}", ex.getMessage());

    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
      fieldErrors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
    }
    Map<String, Object> body =
        body("VALIDATION_FAILED", "Input validation failed. Please check the provided data.");
    body.put("fieldErrors", fieldErrors);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> handleConstraintViolation(
      ConstraintViolationException ex) {
    log.warn("Constraint validation failed: {}", ex.getMessage());

    Map<String, String> violations =
        ex.getConstraintViolations().stream()
            .collect(
                Collectors.toMap(
                    violation -> violation.getPropertyPath().toString(),
                    ConstraintViolation::getMessage,
                    (existing, replacement) -> existing));
    Map<String, Object> body = body("CONSTRAINT_VIOLATION", "Data constraints violated");
    body.put("violations", violations);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  /** Malformed JSON and unknown enum values such as an unsupported recipient channel. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(body("MALFORMED_REQUEST", "Request body could not be parsed"));
  }

  /** Invalid path parameters, e.g. a schedule id that is not a UUID. */
  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    log.warn("Type conversion failed for parameter '{}': {}", ex.getName(), ex.getMessage());

    String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "?";
    Map<String, Object> body =
        body(
            "INVALID_FORMAT",
            String.format(
                "Invalid format for parameter '%s'. Expected type: %s", ex.getName(), expected));
    body.put("parameter", ex.getName());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Business rule validation failed: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(body("BUSINESS_RULE_VIOLATION", ex.getMessage()));
  }

  @ExceptionHandler(UnauthorizedException.class)
  public ResponseEntity<Map<String, Object>> handleUnauthorized(UnauthorizedException ex) {
    log.debug("Rejected request: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(body("UNAUTHORIZED", ex.getMessage()));
  }

  @ExceptionHandler(ScheduleNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(ScheduleNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ScheduleConflictException.class)
  public ResponseEntity<Map<String, Object>> handleConflict(ScheduleConflictException ex) {
    log.info("Conflict: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body("CONFLICT", ex.getMessage()));
  }

  @ExceptionHandler(RateLimitExceededException.class)
  public ResponseEntity<Map<String, Object>> handleRateLimit(RateLimitExceededException ex) {
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
        .body(body("RATE_LIMITED", ex.getMessage()));
  }

  /** Database outage or a saturated worker pool; the client may retry. */
  @ExceptionHandler({StoreUnavailableException.class, ExecutionRejectedException.class})
  public ResponseEntity<Map<String, Object>> handleUnavailable(RuntimeException ex) {
    log.warn("Service temporarily unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(body("SERVICE_UNAVAILABLE", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
    log.error("Unexpected error occurred", ex);

    Map<String, Object> body =
        body("INTERNAL_SERVER_ERROR", "An unexpected error occurred. Please try again later.");
    if (log.isDebugEnabled()) {
      body.put("debugMessage", ex.getMessage());
    }
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }

  private Map<String, Object> body(String error, String message) {
    Map<String, Object> body = new HashMap<>();
    body.put("error", error);
    body.put("message", message);
    body.put("timestamp", Instant.now(clock).toString());
    return body;
  }
}
