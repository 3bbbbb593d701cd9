package io.trackwise.backend.task;

/**
 * Task lifecycle status. Which changes between statuses are permitted is decided by the project's
 * workflow, not by this enum.
 */
public enum TaskStatus {
  DRAFT(StatusCategory.TODO),
  ASSIGNED(StatusCategory.TODO),
  IN_PROGRESS(StatusCategory.IN_PROGRESS),
  PAUSED(StatusCategory.IN_PROGRESS),
  REVIEW(StatusCategory.REVIEW),
  COMPLETED(StatusCategory.DONE),
  REJECTED(StatusCategory.DONE);

  private final StatusCategory category;

  TaskStatus(StatusCategory category) {
    this.category = category;
  }

  public StatusCategory category() {
    return category;
  }

  /**
   * Returns true for COMPLETED and REJECTED. A task in a terminal status no longer blocks its
   * dependents and counts as done in subtask summaries.
   */
  public boolean isTerminal() {
    return category == StatusCategory.DONE;
  }

  /** Status for a newly created task: ASSIGNED when created with assignees, DRAFT otherwise. */
  public static TaskStatus initial(boolean hasAssignees) {
    return hasAssignees ? ASSIGNED : DRAFT;
  }
}
