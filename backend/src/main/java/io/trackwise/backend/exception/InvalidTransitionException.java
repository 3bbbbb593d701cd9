package io.trackwise.backend.exception;

import io.trackwise.backend.member.ProjectRole;
import io.trackwise.backend.task.TaskStatus;
import io.trackwise.backend.workflow.WorkflowType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A status change is not permitted by the project's workflow: either no rule covers the (from, to)
 * pair, or the matching rule requires a project role the caller does not hold. Results in HTTP 422.
 */
public class InvalidTransitionException extends ErrorResponseException {

  public InvalidTransitionException(
      WorkflowType workflowType,
      TaskStatus from,
      TaskStatus to,
      String transitionName,
      ProjectRole requiredRole,
      String detail) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(workflowType, from, to, transitionName, requiredRole, detail),
        null);
  }

  private static ProblemDetail createProblem(
      WorkflowType workflowType,
      TaskStatus from,
      TaskStatus to,
      String transitionName,
      ProjectRole requiredRole,
      String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Invalid status transition");
    problem.setDetail(detail);
    problem.setProperty("workflowType", workflowType.name());
    problem.setProperty("fromStatus", from.name());
    problem.setProperty("toStatus", to.name());
    if (transitionName != null) {
      problem.setProperty("transition", transitionName);
    }
    if (requiredRole != null) {
      problem.setProperty("requiredRole", requiredRole.name());
    }
    return problem;
  }
}
