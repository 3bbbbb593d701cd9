package io.trackwise.backend.activity;

import io.trackwise.backend.audit.AuditEventRecord;
import io.trackwise.backend.audit.AuditService;
import io.trackwise.backend.event.TaskActivityEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes engine activity to the audit trail. Runs AFTER_COMMIT, so:
 *
 * <ol>
 *   <li>only committed changes are recorded;
 *   <li>a recording failure is logged and never undoes or fails the change itself.
 * </ol>
 */
@Component
public class ActivityEventHandler {

  private static final Logger log = LoggerFactory.getLogger(ActivityEventHandler.class);

  private final AuditService auditService;

  public ActivityEventHandler(AuditService auditService) {
    this.auditService = auditService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onActivity(TaskActivityEvent event) {
    try {
      auditService.log(
          new AuditEventRecord(
              event.eventType(),
              event.entityType(),
              event.entityId(),
              event.projectId(),
              event.actorMemberId(),
              event.details()),
          event.occurredAt());
    } catch (Exception e) {
      log.warn(
          "Failed to record activity for {} event={}", event.eventType(), event.entityId(), e);
    }
  }
}
