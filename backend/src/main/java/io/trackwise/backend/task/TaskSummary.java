package io.trackwise.backend.task;

import java.util.UUID;

/** Denormalized task reference embedded in dependency, tree and graph responses. */
public record TaskSummary(UUID id, String key, String title, TaskStatus status) {

  public static TaskSummary from(Task task) {
    return new TaskSummary(task.getId(), task.getTaskKey(), task.getTitle(), task.getStatus());
  }
}
