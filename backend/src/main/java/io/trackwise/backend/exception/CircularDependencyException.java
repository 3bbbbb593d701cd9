package io.trackwise.backend.exception;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Adding a dependency edge would close a cycle in the blocking graph. The {@code path} property
 * lists the task ids of the cycle, starting and ending with the dependent task. Results in HTTP 409.
 */
public class CircularDependencyException extends ErrorResponseException {

  private final List<UUID> path;

  public CircularDependencyException(List<UUID> path) {
    super(HttpStatus.CONFLICT, createProblem(path), null);
    this.path = List.copyOf(path);
  }

  public List<UUID> getPath() {
    return path;
  }

  private static ProblemDetail createProblem(List<UUID> path) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Circular dependency");
    problem.setDetail(
        "This dependency would create a circular dependency chain: "
            + path.stream().map(UUID::toString).collect(Collectors.joining(" -> ")));
    problem.setProperty("path", path);
    return problem;
  }
}
