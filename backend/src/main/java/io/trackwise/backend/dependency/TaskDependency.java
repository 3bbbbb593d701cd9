package io.trackwise.backend.dependency;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Directed edge: {@code dependentTaskId} waits for {@code blockingTaskId}. Immutable once saved. */
@Entity
@Table(name = "task_dependencies")
public class TaskDependency {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "dependent_task_id", nullable = false, updatable = false)
  private UUID dependentTaskId;

  @Column(name = "blocking_task_id", nullable = false, updatable = false)
  private UUID blockingTaskId;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 20, updatable = false)
  private DependencyType type;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TaskDependency() {}

  public TaskDependency(UUID dependentTaskId, UUID blockingTaskId, DependencyType type) {
    this.dependentTaskId = dependentTaskId;
    this.blockingTaskId = blockingTaskId;
    this.type = type;
    this.createdAt = Instant.now();
  }

  public boolean isBlocking() {
    return type.isBlocking();
  }

  /** The task on the other end of this edge, seen from {@code taskId}. */
  public UUID otherEnd(UUID taskId) {
    return dependentTaskId.equals(taskId) ? blockingTaskId : dependentTaskId;
  }

  public UUID getId() {
    return id;
  }

  public UUID getDependentTaskId() {
    return dependentTaskId;
  }

  public UUID getBlockingTaskId() {
    return blockingTaskId;
  }

  public DependencyType getType() {
    return type;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
