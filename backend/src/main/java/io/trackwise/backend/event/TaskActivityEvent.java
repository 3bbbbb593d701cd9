package io.trackwise.backend.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Activity published via Spring's ApplicationEventPublisher after an accepted engine mutation. All
 * implementations are records holding ids and enums only, so they stay valid after the publishing
 * transaction commits and the persistence context closes.
 */
public sealed interface TaskActivityEvent
    permits TaskMovedEvent,
        TaskStatusChangedEvent,
        DependencyCreatedEvent,
        DependencyDeletedEvent {

  /** Follows the {@code {entity}.{action}} convention, e.g. {@code task.moved}. */
  String eventType();

  String entityType();

  UUID entityId();

  /** Null for tasks outside any project. */
  UUID projectId();

  /** Null when no authenticated member triggered the change. */
  UUID actorMemberId();

  Instant occurredAt();

  Map<String, Object> details();
}
