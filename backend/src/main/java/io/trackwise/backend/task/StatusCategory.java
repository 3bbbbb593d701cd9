package io.trackwise.backend.task;

/** Board column a raw status is displayed under. Used for grouping, never for enforcement. */
public enum StatusCategory {
  TODO,
  IN_PROGRESS,
  REVIEW,
  DONE
}
