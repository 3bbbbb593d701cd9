package io.trackwise.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Malformed or self-referential input to the engine, e.g. a task depending on itself or a duplicate
 * dependency edge. Results in HTTP 400 with a machine-readable {@code code} property.
 */
public class ValidationException extends ErrorResponseException {

  private final String code;

  public ValidationException(String code, String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(code, title, detail), null);
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  private static ProblemDetail createProblem(String code, String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", code);
    return problem;
  }
}
