package io.saasfunnel.analytics.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The upstream data source could not deliver a snapshot. */
public class SnapshotUnavailableException extends ErrorResponseException {

  public SnapshotUnavailableException(String source, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(source), cause);
  }

  private static ProblemDetail createProblem(String source) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Snapshot unavailable");
    problem.setDetail("Could not load input tables from " + source);
    return problem;
  }
}
