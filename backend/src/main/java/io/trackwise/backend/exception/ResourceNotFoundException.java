package io.trackwise.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A referenced task, dependency or project does not exist. Results in HTTP 404. */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;
  private final Object resourceId;

  public ResourceNotFoundException(String resourceType, Object resourceId) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, resourceId), null);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public Object getResourceId() {
    return resourceId;
  }

  private static ProblemDetail createProblem(String resourceType, Object resourceId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail("No " + resourceType.toLowerCase() + " found with id " + resourceId);
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("resourceId", String.valueOf(resourceId));
    return problem;
  }
}
