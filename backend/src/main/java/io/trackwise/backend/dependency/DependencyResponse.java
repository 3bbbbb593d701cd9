package io.trackwise.backend.dependency;

import io.trackwise.backend.task.Task;
import io.trackwise.backend.task.TaskSummary;
import java.time.Instant;
import java.util.UUID;

/** A stored dependency with both ends denormalized. */
public record DependencyResponse(
    UUID id,
    DependencyType type,
    TaskSummary dependentTask,
    TaskSummary blockingTask,
    Instant createdAt) {

  public static DependencyResponse from(TaskDependency dependency, Task dependent, Task blocking) {
    return new DependencyResponse(
        dependency.getId(),
        dependency.getType(),
        TaskSummary.from(dependent),
        TaskSummary.from(blocking),
        dependency.getCreatedAt());
  }
}
