package io.saasfunnel.analytics.exception;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidArgumentException.class)
  public ResponseEntity<ProblemDetail> handleInvalidArgument(InvalidArgumentException ex) {
    log.warn("Rejected metrics request: {}", ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(SchemaMismatchException.class)
  public ResponseEntity<ProblemDetail> handleSchemaMismatch(SchemaMismatchException ex) {
    log.warn(
        "Schema mismatch: table={}, column={}, detail={}",
        ex.getTable(),
        ex.getColumn(),
        ex.getBody().getDetail());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(SnapshotUnavailableException.class)
  public ResponseEntity<ProblemDetail> handleSnapshotUnavailable(SnapshotUnavailableException ex) {
    log.error("Snapshot load failed: {}", ex.getBody().getDetail(), ex.getCause());
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(IOException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableUpload(IOException ex) {
    log.warn("Unreadable upload: {}", ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Unreadable upload");
    problem.setDetail("Uploaded file could not be read as delimited text");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }
}
