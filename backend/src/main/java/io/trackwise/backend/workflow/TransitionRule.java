package io.trackwise.backend.workflow;

import io.trackwise.backend.member.ProjectRole;
import io.trackwise.backend.task.TaskStatus;
import java.util.Objects;

/**
 * One permitted status change within a workflow.
 *
 * @param name label shown to users, e.g. "Submit for Review"
 * @param from status the task must currently be in
 * @param to status the task ends up in
 * @param requiredRole project role the caller must hold, compared as the workflow's {@link
 *     RoleMatch} says; null when any member may use it
 */
public record TransitionRule(String name, TaskStatus from, TaskStatus to, ProjectRole requiredRole) {

  public TransitionRule {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }

  public static TransitionRule open(String name, TaskStatus from, TaskStatus to) {
    return new TransitionRule(name, from, to, null);
  }

  public static TransitionRule restricted(
      String name, TaskStatus from, TaskStatus to, ProjectRole requiredRole) {
    return new TransitionRule(name, from, to, Objects.requireNonNull(requiredRole, "requiredRole"));
  }

  public boolean connects(TaskStatus from, TaskStatus to) {
    return this.from == from && this.to == to;
  }

  public boolean isUsableBy(ProjectRole role, RoleMatch match) {
    return match.accepts(requiredRole, role);
  }
}
