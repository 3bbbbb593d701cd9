package io.trackwise.backend.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A unit of work. Tasks are created and deleted by the surrounding application; the engine only
 * changes their status and parent pointer.
 */
@Entity
@Table(name = "tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "task_key", nullable = false, length = 30, updatable = false)
  private String taskKey;

  @Column(name = "project_id")
  private UUID projectId;

  @Column(name = "parent_id")
  private UUID parentId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Column(name = "type", nullable = false, length = 30)
  private String type;

  @Column(name = "estimated_hours", precision = 10, scale = 2)
  private BigDecimal estimatedHours;

  @Column(name = "logged_hours", precision = 10, scale = 2)
  private BigDecimal loggedHours;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(
      String taskKey,
      UUID projectId,
      UUID parentId,
      String title,
      String type,
      TaskPriority priority,
      boolean hasAssignees) {
    this.taskKey = taskKey;
    this.projectId = projectId;
    this.parentId = parentId;
    this.title = title;
    this.type = type != null ? type : "TASK";
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.status = TaskStatus.initial(hasAssignees);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Applies a status change that the workflow has already approved. */
  public void changeStatus(TaskStatus newStatus) {
    this.status = newStatus;
    this.updatedAt = Instant.now();
  }

  /** Re-parents this task. A null parent moves the task to root level. */
  public void moveTo(UUID newParentId) {
    this.parentId = newParentId;
    this.updatedAt = Instant.now();
  }

  public void recordEffort(BigDecimal estimatedHours, BigDecimal loggedHours) {
    this.estimatedHours = estimatedHours;
    this.loggedHours = loggedHours;
    this.updatedAt = Instant.now();
  }

  public boolean isInSameScopeAs(Task other) {
    return projectId == null ? other.projectId == null : projectId.equals(other.projectId);
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getTaskKey() {
    return taskKey;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getParentId() {
    return parentId;
  }

  public String getTitle() {
    return title;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public String getType() {
    return type;
  }

  public BigDecimal getEstimatedHours() {
    return estimatedHours;
  }

  public BigDecimal getLoggedHours() {
    return loggedHours;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
