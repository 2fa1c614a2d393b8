package io.saasfunnel.analytics.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** An unsupported parameter value, such as an unknown cohort bucket or growth metric. */
public class InvalidArgumentException extends ErrorResponseException {

  public InvalidArgumentException(String parameter, Object value, String detail) {
    super(
        HttpStatus.BAD_REQUEST,
        createProblem("Invalid " + parameter, "Unsupported value '" + value + "': " + detail),
        null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
