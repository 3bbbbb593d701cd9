package io.trackwise.backend.event;

import io.trackwise.backend.dependency.DependencyType;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record DependencyDeletedEvent(
    UUID dependencyId,
    UUID dependentTaskId,
    UUID blockingTaskId,
    DependencyType type,
    UUID projectId,
    UUID actorMemberId,
    Instant occurredAt)
    implements TaskActivityEvent {

  @Override
  public String eventType() {
    return "dependency.deleted";
  }

  @Override
  public String entityType() {
    return "task_dependency";
  }

  @Override
  public UUID entityId() {
    return dependencyId;
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "dependent_task_id", dependentTaskId.toString(),
        "blocking_task_id", blockingTaskId.toString(),
        "type", type.name());
  }
}
