package io.trackwise.backend.hierarchy;

import io.trackwise.backend.dependency.SubtaskSummary;
import io.trackwise.backend.event.TaskMovedEvent;
import io.trackwise.backend.exception.HierarchyValidationException;
import io.trackwise.backend.exception.ResourceNotFoundException;
import io.trackwise.backend.exception.ValidationException;
import io.trackwise.backend.security.CurrentMember;
import io.trackwise.backend.task.Task;
import io.trackwise.backend.task.TaskRepository;
import io.trackwise.backend.task.TaskSummary;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Parent/child structure of tasks: rendering subtrees and validated re-parenting. Every call loads
 * the task's whole scope once and works on the in-memory {@link TaskHierarchy}.
 */
@Service
public class TaskHierarchyService {

  private static final Logger log = LoggerFactory.getLogger(TaskHierarchyService.class);

  private final TaskRepository taskRepository;
  private final HierarchyProperties properties;
  private final ApplicationEventPublisher eventPublisher;

  public TaskHierarchyService(
      TaskRepository taskRepository,
      HierarchyProperties properties,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.properties = properties;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Renders the subtree under {@code rootTaskId}. Children are expanded down to {@code maxDepth}
   * levels below the root; nodes on the last level keep {@code hasChildren} but list no children.
   *
   * @param maxDepth levels to expand, 1 to the configured maximum; null for the default
   */
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public TaskTreeNode buildTaskTree(UUID rootTaskId, Integer maxDepth) {
    int depthLimit = maxDepth != null ? maxDepth : properties.defaultTreeDepth();
    if (depthLimit < 1 || depthLimit > properties.maxTreeDepth()) {
      throw new ValidationException(
          "INVALID_MAX_DEPTH",
          "Invalid tree depth",
          "maxDepth must be between 1 and " + properties.maxTreeDepth());
    }

    var root = requireTask(rootTaskId);
    var hierarchy = loadScope(root);
    return node(hierarchy, root, 0, depthLimit);
  }

  /**
   * Moves a task under a new parent, or to root level when {@code newParentId} is null. The task
   * keeps its own subtree.
   */
  @Transactional(isolation = Isolation.SERIALIZABLE)
  public TaskPlacement moveTask(UUID taskId, UUID newParentId) {
    var task = requireTask(taskId);
    Task newParent = newParentId != null ? requireTask(newParentId) : null;

    if (newParent != null && newParentId.equals(taskId)) {
      throw new HierarchyValidationException(
          HierarchyRule.CIRCULAR_REFERENCE, "A task cannot be its own parent");
    }
    if (newParent != null && !task.isInSameScopeAs(newParent)) {
      throw new HierarchyValidationException(
          HierarchyRule.CROSS_PROJECT, "Parent task must belong to the same project");
    }

    var hierarchy = loadScope(task);
    int parentDepth = -1;
    if (newParent != null) {
      if (hierarchy.isAncestor(taskId, newParentId)) {
        throw new HierarchyValidationException(
            HierarchyRule.CIRCULAR_REFERENCE,
            "Task %s cannot move under its own descendant %s"
                .formatted(task.getTaskKey(), newParent.getTaskKey()));
      }
      parentDepth = hierarchy.depthOf(newParentId);
    }

    int newDepth = parentDepth + 1;
    int deepest = newDepth + hierarchy.subtreeHeight(taskId);
    if (deepest > properties.maxDepth()) {
      throw new HierarchyValidationException(
          HierarchyRule.MAX_DEPTH_EXCEEDED,
          "Moving %s would place a task at depth %d, the limit is %d"
              .formatted(task.getTaskKey(), deepest, properties.maxDepth()),
          properties.maxDepth(),
          deepest);
    }

    var oldParentId = task.getParentId();
    task.moveTo(newParentId);
    taskRepository.save(task);
    log.info("Moved task {} from parent {} to {}", task.getTaskKey(), oldParentId, newParentId);

    eventPublisher.publishEvent(
        new TaskMovedEvent(
            taskId,
            task.getProjectId(),
            oldParentId,
            newParentId,
            CurrentMember.idOrNull(),
            Instant.now()));

    return new TaskPlacement(taskId, oldParentId, newParentId, newDepth);
  }

  private TaskTreeNode node(TaskHierarchy hierarchy, Task task, int depth, int depthLimit) {
    var children = hierarchy.childrenOf(task.getId());
    int completion =
        children.isEmpty()
            ? (task.getStatus().isTerminal() ? 100 : 0)
            : SubtaskSummary.of(task.getId(), children).completionPercentage();

    List<TaskTreeNode> childNodes =
        depth < depthLimit
            ? children.stream().map(child -> node(hierarchy, child, depth + 1, depthLimit)).toList()
            : List.of();

    return new TaskTreeNode(
        TaskSummary.from(task), depth, !children.isEmpty(), completion, childNodes);
  }

  private TaskHierarchy loadScope(Task task) {
    var scope =
        task.getProjectId() != null
            ? taskRepository.findByProjectId(task.getProjectId())
            : taskRepository.findWithoutProject();
    return new TaskHierarchy(scope, properties.ancestorHopLimit());
  }

  private Task requireTask(UUID taskId) {
    return taskRepository
        .findOneById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }
}
