package io.trackwise.backend.workflow;

import io.trackwise.backend.event.TaskStatusChangedEvent;
import io.trackwise.backend.exception.InvalidTransitionException;
import io.trackwise.backend.exception.ResourceNotFoundException;
import io.trackwise.backend.member.ProjectMember;
import io.trackwise.backend.member.ProjectMemberRepository;
import io.trackwise.backend.member.ProjectRole;
import io.trackwise.backend.project.Project;
import io.trackwise.backend.project.ProjectRepository;
import io.trackwise.backend.task.Task;
import io.trackwise.backend.task.TaskRepository;
import io.trackwise.backend.task.TaskStatus;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies workflow rules to real tasks. Resolves the workflow from the task's project (BASIC for
 * tasks outside any project) and the caller's role from project membership.
 *
 * <p>CUSTOM projects are evaluated against their stored rules that apply to the task's type. A
 * CUSTOM project that has stored no rules yet accepts any change of status.
 */
@Service
public class TaskTransitionService {

  private static final Logger log = LoggerFactory.getLogger(TaskTransitionService.class);

  private final TaskRepository taskRepository;
  private final ProjectRepository projectRepository;
  private final ProjectMemberRepository projectMemberRepository;
  private final CustomWorkflowTransitionRepository customTransitionRepository;
  private final WorkflowDefinitionRegistry registry;
  private final TransitionValidator validator;
  private final ApplicationEventPublisher eventPublisher;

  public TaskTransitionService(
      TaskRepository taskRepository,
      ProjectRepository projectRepository,
      ProjectMemberRepository projectMemberRepository,
      CustomWorkflowTransitionRepository customTransitionRepository,
      WorkflowDefinitionRegistry registry,
      TransitionValidator validator,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.projectRepository = projectRepository;
    this.projectMemberRepository = projectMemberRepository;
    this.customTransitionRepository = customTransitionRepository;
    this.registry = registry;
    this.validator = validator;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public TransitionResult changeStatus(UUID taskId, TaskStatus target, UUID memberId) {
    var task = requireTask(taskId);
    var context = resolveContext(task, memberId);
    var from = task.getStatus();

    if (from == target) {
      throw new InvalidTransitionException(
          context.type(), from, target, null, null, "Task is already in status " + target);
    }

    String transitionName = null;
    if (!context.acceptsAnything()) {
      var check = validator.check(context.definition(), from, target, context.role());
      if (!check.allowed()) {
        log.info(
            "Refused transition of task {} from {} to {} for member {}: {}",
            task.getTaskKey(),
            from,
            target,
            memberId,
            check.reason());
        throw new InvalidTransitionException(
            context.type(),
            from,
            target,
            check.rule() != null ? check.rule().name() : null,
            check.rule() != null ? check.rule().requiredRole() : null,
            check.reason());
      }
      transitionName = check.rule().name();
    }

    task.changeStatus(target);
    taskRepository.save(task);
    log.info(
        "Task {} moved from {} to {} via {} ({} workflow)",
        task.getTaskKey(),
        from,
        target,
        transitionName,
        context.type());

    eventPublisher.publishEvent(
        new TaskStatusChangedEvent(
            taskId, task.getProjectId(), from, target, transitionName, memberId, Instant.now()));

    return new TransitionResult(taskId, context.type(), from, target, transitionName);
  }

  /** Rules the member may use from the task's current status. */
  @Transactional(readOnly = true)
  public List<TransitionRule> availableTransitions(UUID taskId, UUID memberId) {
    var task = requireTask(taskId);
    var context = resolveContext(task, memberId);
    return validator.available(context.definition(), task.getStatus(), context.role());
  }

  public WorkflowDefinition describe(WorkflowType type) {
    return registry.get(type);
  }

  private WorkflowContext resolveContext(Task task, UUID memberId) {
    if (task.getProjectId() == null) {
      return new WorkflowContext(WorkflowType.BASIC, registry.get(WorkflowType.BASIC), null);
    }

    Project project =
        projectRepository
            .findOneById(task.getProjectId())
            .orElseThrow(() -> new ResourceNotFoundException("Project", task.getProjectId()));
    var role =
        memberId == null
            ? null
            : projectMemberRepository
                .findByProjectIdAndMemberId(project.getId(), memberId)
                .map(ProjectMember::getProjectRole)
                .orElse(null);

    var type = project.getWorkflowType();
    if (!type.isCustom()) {
      return new WorkflowContext(type, registry.get(type), role);
    }
    var stored = customTransitionRepository.findByProjectIdOrderByPositionAsc(project.getId());
    var definition = new WorkflowDefinition(type, customRules(stored, task.getType()));
    return new WorkflowContext(type, definition, role, stored.isEmpty());
  }

  /** One rule per status pair; a rule scoped to the task type wins over an unscoped one. */
  private static List<TransitionRule> customRules(
      List<CustomWorkflowTransition> stored, String taskType) {
    var byPair = new LinkedHashMap<List<TaskStatus>, CustomWorkflowTransition>();
    for (var transition : stored) {
      if (!transition.appliesTo(taskType)) {
        continue;
      }
      var pair = List.of(transition.getFromStatus(), transition.getToStatus());
      var existing = byPair.get(pair);
      boolean moreSpecific =
          existing != null && existing.getIssueType() == null && transition.getIssueType() != null;
      if (existing == null || moreSpecific) {
        byPair.put(pair, transition);
      }
    }
    return byPair.values().stream().map(CustomWorkflowTransition::toRule).toList();
  }

  private Task requireTask(UUID taskId) {
    return taskRepository
        .findOneById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }

  /**
   * @param acceptsAnything CUSTOM project with no stored rules at all
   */
  private record WorkflowContext(
      WorkflowType type, WorkflowDefinition definition, ProjectRole role, boolean acceptsAnything) {

    WorkflowContext(WorkflowType type, WorkflowDefinition definition, ProjectRole role) {
      this(type, definition, role, false);
    }
  }
}
