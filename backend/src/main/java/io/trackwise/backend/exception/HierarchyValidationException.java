package io.trackwise.backend.exception;

import io.trackwise.backend.hierarchy.HierarchyRule;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A parent/child move was refused. Carries the rule that failed and, for depth violations, the
 * configured limit and the depth the move would have produced. Results in HTTP 422.
 */
public class HierarchyValidationException extends ErrorResponseException {

  private final HierarchyRule rule;

  public HierarchyValidationException(HierarchyRule rule, String detail) {
    this(rule, detail, null, null);
  }

  public HierarchyValidationException(
      HierarchyRule rule, String detail, Integer limit, Integer actual) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(rule, detail, limit, actual), null);
    this.rule = rule;
  }

  public HierarchyRule getRule() {
    return rule;
  }

  private static ProblemDetail createProblem(
      HierarchyRule rule, String detail, Integer limit, Integer actual) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Invalid task hierarchy");
    problem.setDetail(detail);
    problem.setProperty("rule", rule.name());
    if (limit != null) {
      problem.setProperty("limit", limit);
    }
    if (actual != null) {
      problem.setProperty("actual", actual);
    }
    return problem;
  }
}
