package com.delta.catalogcrawler.crawl.api;

import com.delta.catalogcrawler.crawl.error.InvalidRequestException;
import com.delta.catalogcrawler.crawl.error.JobNotFoundException;
import com.delta.catalogcrawler.crawl.error.PersistenceUnavailableException;
import com.delta.catalogcrawler.crawl.error.ResourceExhaustionException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", ex.getReasonCode(), "message", ex.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "malformed_request", "message", "request body could not be parsed"));
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(ResourceExhaustionException.class)
  public ResponseEntity<Map<String, String>> handleExhausted(ResourceExhaustionException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", ex.getReasonCode(), "message", ex.getMessage()));
  }

  @ExceptionHandler(PersistenceUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleStoreDown(PersistenceUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "persistence_unavailable", "message", "storage is unavailable"));
  }
}
