package io.trackwise.backend.workflow;

import static io.trackwise.backend.member.ProjectRole.PROJECT_ADMIN;
import static io.trackwise.backend.member.ProjectRole.PROJECT_LEAD;
import static io.trackwise.backend.task.TaskStatus.ASSIGNED;
import static io.trackwise.backend.task.TaskStatus.COMPLETED;
import static io.trackwise.backend.task.TaskStatus.DRAFT;
import static io.trackwise.backend.task.TaskStatus.IN_PROGRESS;
import static io.trackwise.backend.task.TaskStatus.PAUSED;
import static io.trackwise.backend.task.TaskStatus.REJECTED;
import static io.trackwise.backend.task.TaskStatus.REVIEW;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable lookup of workflow definitions by type. Built once at startup by {@link WorkflowConfig}
 * and injected wherever transitions are evaluated.
 *
 * <p>BASIC, AGILE and BUG_TRACKING share one built-in table. CUSTOM is registered with an empty
 * table; its rules live with each project.
 */
public final class WorkflowDefinitionRegistry {

  static final List<TransitionRule> STANDARD_TRANSITIONS =
      List.of(
          TransitionRule.open("Assign", DRAFT, ASSIGNED),
          TransitionRule.open("Start Work", DRAFT, IN_PROGRESS),
          TransitionRule.open("Start Work", ASSIGNED, IN_PROGRESS),
          TransitionRule.open("Back to Draft", ASSIGNED, DRAFT),
          TransitionRule.open("Submit for Review", IN_PROGRESS, REVIEW),
          TransitionRule.open("Pause Work", IN_PROGRESS, PAUSED),
          TransitionRule.open("Move Back to To Do", IN_PROGRESS, ASSIGNED),
          TransitionRule.restricted("Approve", REVIEW, COMPLETED, PROJECT_LEAD),
          TransitionRule.open("Request Changes", REVIEW, IN_PROGRESS),
          TransitionRule.restricted("Reject", REVIEW, REJECTED, PROJECT_LEAD),
          TransitionRule.open("Resume Work", PAUSED, IN_PROGRESS),
          TransitionRule.restricted("Reject Paused", PAUSED, REJECTED, PROJECT_LEAD),
          TransitionRule.open("Reopen", REJECTED, ASSIGNED),
          TransitionRule.restricted("Reopen Completed", COMPLETED, IN_PROGRESS, PROJECT_ADMIN),
          TransitionRule.restricted("Back to Review", COMPLETED, REVIEW, PROJECT_LEAD));

  private final Map<WorkflowType, WorkflowDefinition> definitions;

  public WorkflowDefinitionRegistry(Collection<WorkflowDefinition> definitions) {
    var byType = new EnumMap<WorkflowType, WorkflowDefinition>(WorkflowType.class);
    for (var definition : definitions) {
      if (byType.put(definition.type(), definition) != null) {
        throw new IllegalStateException("Workflow " + definition.type() + " registered twice");
      }
    }
    for (var type : WorkflowType.values()) {
      if (!byType.containsKey(type)) {
        throw new IllegalStateException("No definition registered for workflow " + type);
      }
    }
    this.definitions = Collections.unmodifiableMap(byType);
  }

  /** The built-in registry used in production. */
  public static WorkflowDefinitionRegistry standard() {
    return new WorkflowDefinitionRegistry(
        List.of(
            new WorkflowDefinition(WorkflowType.BASIC, STANDARD_TRANSITIONS),
            new WorkflowDefinition(WorkflowType.AGILE, STANDARD_TRANSITIONS),
            new WorkflowDefinition(WorkflowType.BUG_TRACKING, STANDARD_TRANSITIONS),
            new WorkflowDefinition(WorkflowType.CUSTOM, List.of())));
  }

  public WorkflowDefinition get(WorkflowType type) {
    return definitions.get(type);
  }

  public Collection<WorkflowDefinition> all() {
    return definitions.values();
  }
}
