package com.foiarelay.directory.api;

import com.foiarelay.directory.service.ActivePipelineRunException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DirectoryExceptionHandler {

  @ExceptionHandler(ActivePipelineRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActivePipelineRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_pipeline_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    String message = ex.getMessage() == null ? "invalid request" : ex.getMessage();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", message));
  }
}
