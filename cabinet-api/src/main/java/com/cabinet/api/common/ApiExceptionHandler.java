package com.cabinet.api.common;

import com.cabinet.saas.domain.error.DomainException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(DomainException.class)
  public ResponseEntity<Map<String, Object>> domain(DomainException ex) {
    if (ex.httpStatus() >= 500) {
      log.warn("Upstream failure: code={} message={}", ex.code(), ex.getMessage());
    }
    return ResponseEntity.status(ex.httpStatus()).body(Map.of(
        "status", "error",
        "reason", ex.kind().reason(),
        "error_code", ex.code().name(),
        "message", ex.getMessage() == null ? ex.code().defaultMessage() : ex.getMessage(),
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "bad_request",
        "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> badParameter(MethodArgumentTypeMismatchException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "bad_request",
        "message", "Invalid value for " + ex.getName(),
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "validation_error",
        "message", "invalid_request",
        "fields", fields,
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "validation_error",
        "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
        "ts", Instant.now().toString()
    ));
  }
}
