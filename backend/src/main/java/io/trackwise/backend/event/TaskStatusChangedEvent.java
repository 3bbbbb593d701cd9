package io.trackwise.backend.event;

import io.trackwise.backend.task.TaskStatus;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

public record TaskStatusChangedEvent(
    UUID taskId,
    UUID projectId,
    TaskStatus oldStatus,
    TaskStatus newStatus,
    String transitionName,
    UUID actorMemberId,
    Instant occurredAt)
    implements TaskActivityEvent {

  @Override
  public String eventType() {
    return "task.status_changed";
  }

  @Override
  public String entityType() {
    return "task";
  }

  @Override
  public UUID entityId() {
    return taskId;
  }

  @Override
  public Map<String, Object> details() {
    var details = new HashMap<String, Object>();
    details.put("old_status", oldStatus.name());
    details.put("new_status", newStatus.name());
    details.put("transition", transitionName);
    return details;
  }
}
