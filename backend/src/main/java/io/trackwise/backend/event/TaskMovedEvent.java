package io.trackwise.backend.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

public record TaskMovedEvent(
    UUID taskId,
    UUID projectId,
    UUID oldParentId,
    UUID newParentId,
    UUID actorMemberId,
    Instant occurredAt)
    implements TaskActivityEvent {

  @Override
  public String eventType() {
    return "task.moved";
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
    // parents may be null (root level), which Map.of rejects
    var details = new HashMap<String, Object>();
    details.put("old_parent_id", oldParentId != null ? oldParentId.toString() : null);
    details.put("new_parent_id", newParentId != null ? newParentId.toString() : null);
    return details;
  }
}
