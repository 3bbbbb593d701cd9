package io.trackwise.backend.dependency;

import io.trackwise.backend.event.DependencyCreatedEvent;
import io.trackwise.backend.event.DependencyDeletedEvent;
import io.trackwise.backend.exception.CircularDependencyException;
import io.trackwise.backend.exception.ResourceNotFoundException;
import io.trackwise.backend.exception.ValidationException;
import io.trackwise.backend.project.ProjectRepository;
import io.trackwise.backend.security.CurrentMember;
import io.trackwise.backend.task.Task;
import io.trackwise.backend.task.TaskRepository;
import io.trackwise.backend.task.TaskSummary;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains the task dependency graph and answers questions about it.
 *
 * <p>Creating an edge checks and inserts within one SERIALIZABLE transaction: when two requests
 * would jointly close a cycle, PostgreSQL aborts one of them and the caller gets a 409 to retry.
 */
@Service
public class TaskDependencyService {

  private static final Logger log = LoggerFactory.getLogger(TaskDependencyService.class);

  private final TaskDependencyRepository dependencyRepository;
  private final TaskRepository taskRepository;
  private final ProjectRepository projectRepository;
  private final DependencyGraphLoader graphLoader;
  private final ApplicationEventPublisher eventPublisher;

  public TaskDependencyService(
      TaskDependencyRepository dependencyRepository,
      TaskRepository taskRepository,
      ProjectRepository projectRepository,
      DependencyGraphLoader graphLoader,
      ApplicationEventPublisher eventPublisher) {
    this.dependencyRepository = dependencyRepository;
    this.taskRepository = taskRepository;
    this.projectRepository = projectRepository;
    this.graphLoader = graphLoader;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(isolation = Isolation.SERIALIZABLE)
  public DependencyResponse createDependency(
      UUID dependentTaskId, UUID blockingTaskId, DependencyType type) {
    Objects.requireNonNull(type, "type");
    if (dependentTaskId.equals(blockingTaskId)) {
      throw new ValidationException(
          "SELF_DEPENDENCY", "Invalid dependency", "A task cannot depend on itself");
    }

    var dependent = requireTask(dependentTaskId);
    var blocking = requireTask(blockingTaskId);

    if (dependencyRepository.existsByDependentTaskIdAndBlockingTaskIdAndType(
        dependentTaskId, blockingTaskId, type)) {
      throw new ValidationException(
          "DUPLICATE_DEPENDENCY",
          "Duplicate dependency",
          "A %s dependency from %s on %s already exists"
              .formatted(type, dependent.getTaskKey(), blocking.getTaskKey()));
    }

    if (type.isBlocking()) {
      var graph = graphLoader.loadReachableFrom(blockingTaskId);
      var cycle = CycleDetector.findCycle(graph, dependentTaskId, blockingTaskId);
      if (cycle.isPresent()) {
        log.info(
            "Refused dependency {} -> {}: cycle {}", dependentTaskId, blockingTaskId, cycle.get());
        throw new CircularDependencyException(cycle.get());
      }
    }

    var dependency =
        dependencyRepository.save(new TaskDependency(dependentTaskId, blockingTaskId, type));
    log.info(
        "Created {} dependency {}: {} waits for {}",
        type,
        dependency.getId(),
        dependent.getTaskKey(),
        blocking.getTaskKey());

    eventPublisher.publishEvent(
        new DependencyCreatedEvent(
            dependency.getId(),
            dependentTaskId,
            blockingTaskId,
            type,
            dependent.getProjectId(),
            CurrentMember.idOrNull(),
            Instant.now()));

    return DependencyResponse.from(dependency, dependent, blocking);
  }

  @Transactional
  public void deleteDependency(UUID dependencyId) {
    var dependency =
        dependencyRepository
            .findOneById(dependencyId)
            .orElseThrow(() -> new ResourceNotFoundException("TaskDependency", dependencyId));

    dependencyRepository.delete(dependency);
    log.info("Deleted dependency {}", dependencyId);

    var projectId =
        taskRepository
            .findOneById(dependency.getDependentTaskId())
            .map(Task::getProjectId)
            .orElse(null);
    eventPublisher.publishEvent(
        new DependencyDeletedEvent(
            dependencyId,
            dependency.getDependentTaskId(),
            dependency.getBlockingTaskId(),
            dependency.getType(),
            projectId,
            CurrentMember.idOrNull(),
            Instant.now()));
  }

  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public TaskDependencies getTaskDependencies(UUID taskId) {
    requireTask(taskId);
    var edges = dependencyRepository.findTouching(taskId);
    var tasks = loadTasks(edges);

    var blocking = new ArrayList<LinkedTask>();
    var blockedBy = new ArrayList<LinkedTask>();
    var relatedTo = new ArrayList<LinkedTask>();
    for (var edge : edges) {
      var linked = linkedTask(edge, taskId, tasks);
      if (linked == null) {
        continue;
      }
      if (!edge.isBlocking()) {
        relatedTo.add(linked);
      } else if (edge.getBlockingTaskId().equals(taskId)) {
        blocking.add(linked);
      } else {
        blockedBy.add(linked);
      }
    }
    return new TaskDependencies(
        taskId, List.copyOf(blocking), List.copyOf(blockedBy), List.copyOf(relatedTo));
  }

  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public BlockingInfo getBlockingInfo(UUID taskId) {
    var dependencies = getTaskDependencies(taskId);
    var unfinishedBlockers =
        dependencies.blockedBy().stream()
            .filter(linked -> !linked.task().status().isTerminal())
            .toList();

    boolean blocked = !unfinishedBlockers.isEmpty();
    String reason =
        blocked
            ? "Blocked by: "
                + unfinishedBlockers.stream()
                    .map(linked -> linked.task().title())
                    .collect(Collectors.joining(", "))
            : null;

    return new BlockingInfo(
        taskId, blocked, unfinishedBlockers, dependencies.blocking(), !blocked, reason);
  }

  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public SubtaskSummary getSubtaskSummary(UUID parentTaskId) {
    requireTask(parentTaskId);
    return SubtaskSummary.of(parentTaskId, taskRepository.findChildren(parentTaskId));
  }

  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public DependencyGraphView generateDependencyGraph(UUID projectId) {
    projectRepository
        .findOneById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));

    var projectTasks = taskRepository.findByProjectId(projectId);
    var edges = dependencyRepository.findTouchingProject(projectId);
    var graph = DependencyGraph.of(edges);

    var nodes =
        projectTasks.stream()
            .map(
                task ->
                    new DependencyGraphView.Node(
                        TaskSummary.from(task),
                        graph.dependenciesOf(task.getId()),
                        edges.stream()
                            .filter(
                                edge ->
                                    edge.isBlocking()
                                        && edge.getBlockingTaskId().equals(task.getId()))
                            .map(TaskDependency::getDependentTaskId)
                            .distinct()
                            .toList()))
            .toList();
    var edgeViews =
        edges.stream()
            .map(
                edge ->
                    new DependencyGraphView.Edge(
                        edge.getId(),
                        edge.getDependentTaskId(),
                        edge.getBlockingTaskId(),
                        edge.getType()))
            .toList();

    return new DependencyGraphView(
        projectId, nodes, edgeViews, CycleDetector.findAllCycles(graph));
  }

  /** Filtered listing; every filter is optional. */
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public List<DependencyResponse> listDependencies(
      UUID taskId, UUID projectId, DependencyType type) {
    List<TaskDependency> edges;
    if (taskId != null) {
      edges = dependencyRepository.findTouching(taskId);
    } else if (projectId != null) {
      edges = dependencyRepository.findTouchingProject(projectId);
    } else {
      edges = dependencyRepository.findAllOrdered();
    }

    var tasks = loadTasks(edges);
    return edges.stream()
        .filter(edge -> type == null || edge.getType() == type)
        .filter(edge -> projectId == null || touchesProject(edge, projectId, tasks))
        .filter(
            edge ->
                tasks.containsKey(edge.getDependentTaskId())
                    && tasks.containsKey(edge.getBlockingTaskId()))
        .map(
            edge ->
                DependencyResponse.from(
                    edge,
                    tasks.get(edge.getDependentTaskId()),
                    tasks.get(edge.getBlockingTaskId())))
        .toList();
  }

  private Task requireTask(UUID taskId) {
    return taskRepository
        .findOneById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }

  /** Both ends of every edge in one query. */
  private Map<UUID, Task> loadTasks(Collection<TaskDependency> edges) {
    if (edges.isEmpty()) {
      return Map.of();
    }
    var ids = new HashSet<UUID>();
    edges.forEach(
        edge -> {
          ids.add(edge.getDependentTaskId());
          ids.add(edge.getBlockingTaskId());
        });
    return taskRepository.findAllByIdIn(ids).stream()
        .collect(Collectors.toMap(Task::getId, Function.identity()));
  }

  private static LinkedTask linkedTask(TaskDependency edge, UUID taskId, Map<UUID, Task> tasks) {
    var other = tasks.get(edge.otherEnd(taskId));
    if (other == null) {
      return null;
    }
    return new LinkedTask(edge.getId(), edge.getType(), TaskSummary.from(other));
  }

  private static boolean touchesProject(TaskDependency edge, UUID projectId, Map<UUID, Task> tasks) {
    var dependent = tasks.get(edge.getDependentTaskId());
    var blocking = tasks.get(edge.getBlockingTaskId());
    return (dependent != null && projectId.equals(dependent.getProjectId()))
        || (blocking != null && projectId.equals(blocking.getProjectId()));
  }
}
