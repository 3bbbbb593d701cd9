package io.trackwise.backend.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity affected ("task", "task_dependency")
 * @param entityId ID of the affected entity (not a FK, the entity may be deleted later)
 * @param projectId project the entity belongs to; null for project-less tasks
 * @param actorId member ID of the acting user; null for system-initiated changes
 * @param details key field changes, stored as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID projectId,
    UUID actorId,
    Map<String, Object> details) {}
