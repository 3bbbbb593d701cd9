package io.trackwise.backend.dependency;

import io.trackwise.backend.task.TaskSummary;
import java.util.List;
import java.util.UUID;

/**
 * Whole-project dependency picture for visualisation.
 *
 * @param cycles closed paths found in the stored graph; expected to be empty
 */
public record DependencyGraphView(
    UUID projectId, List<Node> nodes, List<Edge> edges, List<List<UUID>> cycles) {

  /** One project task with the ids of its blocking-type neighbours. */
  public record Node(TaskSummary task, List<UUID> blockedBy, List<UUID> blocking) {}

  public record Edge(UUID id, UUID dependentTaskId, UUID blockingTaskId, DependencyType type) {}
}
