package io.trackwise.backend.workflow;

import io.trackwise.backend.member.ProjectRole;
import io.trackwise.backend.task.TaskStatus;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Decides whether a status change is permitted for a caller holding a given project role. The role
 * comparison lives here and nowhere else. Built-in workflows match the required role exactly;
 * CUSTOM rules accept the required role or any role above it (see {@link RoleMatch}).
 *
 * <p>For the CUSTOM workflow the type-level checks defer to the caller: {@link
 * #isTransitionAllowed} answers true and {@link #getAvailableTransitions} answers an empty list.
 * Project-owned CUSTOM rules are evaluated through {@link #check(WorkflowDefinition, TaskStatus,
 * TaskStatus, ProjectRole)}.
 */
@Component
public class TransitionValidator {

  private final WorkflowDefinitionRegistry registry;

  public TransitionValidator(WorkflowDefinitionRegistry registry) {
    this.registry = registry;
  }

  public boolean isTransitionAllowed(
      WorkflowType type, TaskStatus from, TaskStatus to, ProjectRole role) {
    if (type.isCustom()) {
      return true;
    }
    return check(registry.get(type), from, to, role).allowed();
  }

  public List<TransitionRule> getAvailableTransitions(
      WorkflowType type, TaskStatus current, ProjectRole role) {
    if (type.isCustom()) {
      return List.of();
    }
    return available(registry.get(type), current, role);
  }

  public TransitionCheck check(
      WorkflowDefinition definition, TaskStatus from, TaskStatus to, ProjectRole role) {
    var rule = definition.find(from, to);
    if (rule.isEmpty()) {
      return TransitionCheck.refused(
          null,
          "No transition from %s to %s in the %s workflow".formatted(from, to, definition.type()));
    }
    var matched = rule.get();
    var match = RoleMatch.forWorkflow(definition.type());
    if (!matched.isUsableBy(role, match)) {
      return TransitionCheck.refused(
          matched,
          "Transition '%s' requires role %s%s but caller has %s"
              .formatted(
                  matched.name(),
                  matched.requiredRole(),
                  match == RoleMatch.AT_LEAST ? " or higher" : "",
                  role != null ? role : "none"));
    }
    return TransitionCheck.permitted(matched);
  }

  public List<TransitionRule> available(
      WorkflowDefinition definition, TaskStatus current, ProjectRole role) {
    var match = RoleMatch.forWorkflow(definition.type());
    return definition.from(current).stream()
        .filter(rule -> rule.isUsableBy(role, match))
        .toList();
  }
}
