package io.trackwise.backend.task;

public enum TaskPriority {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
