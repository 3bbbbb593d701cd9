package io.trackwise.backend.dependency;

import io.trackwise.backend.task.StatusCategory;
import io.trackwise.backend.task.Task;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Objects;
import java.util.UUID;

/**
 * Progress of a task's direct children. Grandchildren are not counted.
 *
 * @param completed children in a terminal status
 * @param inProgress children in the IN_PROGRESS or REVIEW category
 * @param todo children in the TODO category
 * @param completionPercentage {@code round(completed / total * 100)}, 0 without children
 * @param remainingHours estimated minus logged hours, never below zero
 */
public record SubtaskSummary(
    UUID parentTaskId,
    int total,
    int completed,
    int inProgress,
    int todo,
    int completionPercentage,
    BigDecimal estimatedHours,
    BigDecimal loggedHours,
    BigDecimal remainingHours) {

  public static SubtaskSummary of(UUID parentTaskId, Collection<Task> children) {
    int completed = 0;
    int inProgress = 0;
    int todo = 0;
    for (var child : children) {
      var status = child.getStatus();
      if (status.isTerminal()) {
        completed++;
      } else if (status.category() == StatusCategory.TODO) {
        todo++;
      } else {
        inProgress++;
      }
    }

    var estimated = sum(children.stream().map(Task::getEstimatedHours).toList());
    var logged = sum(children.stream().map(Task::getLoggedHours).toList());
    var remaining = estimated.subtract(logged).max(BigDecimal.ZERO);

    return new SubtaskSummary(
        parentTaskId,
        children.size(),
        completed,
        inProgress,
        todo,
        percentage(completed, children.size()),
        estimated,
        logged,
        remaining);
  }

  static int percentage(int completed, int total) {
    if (total == 0) {
      return 0;
    }
    return BigDecimal.valueOf(completed * 100L)
        .divide(BigDecimal.valueOf(total), 0, RoundingMode.HALF_UP)
        .intValue();
  }

  private static BigDecimal sum(Collection<BigDecimal> values) {
    return values.stream().filter(Objects::nonNull).reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
