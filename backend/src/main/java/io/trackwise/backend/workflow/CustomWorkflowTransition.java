package io.trackwise.backend.workflow;

import io.trackwise.backend.member.ProjectRole;
import io.trackwise.backend.task.TaskStatus;
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

/**
 * A transition rule owned by a project running the CUSTOM workflow. A rule with an {@code
 * issueType} applies only to tasks of that type and takes precedence over a rule for the same
 * status pair without one.
 */
@Entity
@Table(name = "custom_workflow_transitions")
public class CustomWorkflowTransition {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "from_status", nullable = false, length = 20)
  private TaskStatus fromStatus;

  @Enumerated(EnumType.STRING)
  @Column(name = "to_status", nullable = false, length = 20)
  private TaskStatus toStatus;

  @Enumerated(EnumType.STRING)
  @Column(name = "required_role", length = 30)
  private ProjectRole requiredRole;

  @Column(name = "issue_type", length = 30)
  private String issueType;

  @Column(name = "position", nullable = false)
  private int position;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CustomWorkflowTransition() {}

  public CustomWorkflowTransition(
      UUID projectId,
      String name,
      TaskStatus fromStatus,
      TaskStatus toStatus,
      ProjectRole requiredRole,
      int position) {
    this(projectId, name, fromStatus, toStatus, requiredRole, null, position);
  }

  public CustomWorkflowTransition(
      UUID projectId,
      String name,
      TaskStatus fromStatus,
      TaskStatus toStatus,
      ProjectRole requiredRole,
      String issueType,
      int position) {
    this.projectId = projectId;
    this.name = name;
    this.fromStatus = fromStatus;
    this.toStatus = toStatus;
    this.requiredRole = requiredRole;
    this.issueType = issueType;
    this.position = position;
    this.createdAt = Instant.now();
  }

  public TransitionRule toRule() {
    return new TransitionRule(name, fromStatus, toStatus, requiredRole);
  }

  /** True when this rule is unscoped or scoped to the given task type. */
  public boolean appliesTo(String taskType) {
    return issueType == null || issueType.equals(taskType);
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getName() {
    return name;
  }

  public TaskStatus getFromStatus() {
    return fromStatus;
  }

  public TaskStatus getToStatus() {
    return toStatus;
  }

  public ProjectRole getRequiredRole() {
    return requiredRole;
  }

  public String getIssueType() {
    return issueType;
  }

  public int getPosition() {
    return position;
  }
}
