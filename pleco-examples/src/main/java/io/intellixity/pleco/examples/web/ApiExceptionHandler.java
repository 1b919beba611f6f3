package io.intellixity.pleco.examples.web;

import io.intellixity.pleco.compile.MissingSubqueryException;
import io.intellixity.pleco.jdbc.QueryExecutionException;
import io.intellixity.pleco.query.MalformedFilterException;
import io.intellixity.pleco.querybuilder.QueryConfigurationException;
import io.intellixity.pleco.schema.FilterValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(FilterValidationException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidInput(FilterValidationException ex) {
    log.warn("Rejected list query: {}", ex.getMessage());
    Map<String, Object> body = body("Invalid list query", ex.getMessage());
    body.put("path", ex.path());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(MalformedFilterException.class)
  public ResponseEntity<Map<String, Object>> handleMalformed(MalformedFilterException ex) {
    log.warn("Malformed filter: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("Malformed filter", ex.getMessage()));
  }

  @ExceptionHandler(MissingSubqueryException.class)
  public ResponseEntity<Map<String, Object>> handleMissingSubquery(MissingSubqueryException ex) {
    log.warn("Unresolvable field '{}': {}", ex.field(), ex.getMessage());
    Map<String, Object> body = body("Unknown field", ex.getMessage());
    body.put("path", ex.field());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler({QueryConfigurationException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, Object>> handleBadQuery(RuntimeException ex) {
    log.warn("Rejected list query: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body("Invalid list query", ex.getMessage()));
  }

  @ExceptionHandler(QueryExecutionException.class)
  public ResponseEntity<Map<String, Object>> handleExecution(QueryExecutionException ex) {
    log.error("Query execution failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("Query execution failed", ex.getMessage()));
  }

  private static Map<String, Object> body(String error, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", error);
    body.put("message", message);
    return body;
  }
}
