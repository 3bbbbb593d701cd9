package io.trackwise.backend.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Records and reads the engine's activity trail. */
public interface AuditService {

  /**
   * Records one activity row in its own transaction, so a failure here never rolls back the change
   * being recorded.
   *
   * @param record the event data to persist
   * @param occurredAt when the change happened; now when null
   */
  void log(AuditEventRecord record, Instant occurredAt);

  /** Activity for one entity, newest first. */
  List<AuditEvent> findForEntity(String entityType, UUID entityId);
}
