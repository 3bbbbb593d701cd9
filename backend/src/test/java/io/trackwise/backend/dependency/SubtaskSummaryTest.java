package io.trackwise.backend.dependency;

import static io.trackwise.backend.testutil.TestEntities.task;
import static io.trackwise.backend.testutil.TestEntities.withEffort;
import static org.assertj.core.api.Assertions.assertThat;

import io.trackwise.backend.task.TaskStatus;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SubtaskSummaryTest {

  private static final UUID PARENT = UUID.randomUUID();

  @Test
  void counts_children_by_category() {
    var children =
        List.of(
            task("done", null, PARENT, TaskStatus.COMPLETED),
            task("rejected", null, PARENT, TaskStatus.REJECTED),
            task("working", null, PARENT, TaskStatus.IN_PROGRESS),
            task("paused", null, PARENT, TaskStatus.PAUSED),
            task("review", null, PARENT, TaskStatus.REVIEW),
            task("draft", null, PARENT, TaskStatus.DRAFT),
            task("assigned", null, PARENT, TaskStatus.ASSIGNED));

    var summary = SubtaskSummary.of(PARENT, children);

    assertThat(summary.total()).isEqualTo(7);
    assertThat(summary.completed()).isEqualTo(2);
    assertThat(summary.inProgress()).isEqualTo(3);
    assertThat(summary.todo()).isEqualTo(2);
    assertThat(summary.completed() + summary.inProgress() + summary.todo())
        .isEqualTo(summary.total());
    assertThat(summary.completionPercentage()).isEqualTo(29);
  }

  @Test
  void no_children_means_zero_percent() {
    var summary = SubtaskSummary.of(PARENT, List.of());

    assertThat(summary.total()).isZero();
    assertThat(summary.completionPercentage()).isZero();
    assertThat(summary.remainingHours()).isEqualByComparingTo(BigDecimal.ZERO);
  }

  @Test
  void percentage_rounds_half_up() {
    assertThat(SubtaskSummary.percentage(1, 3)).isEqualTo(33);
    assertThat(SubtaskSummary.percentage(2, 3)).isEqualTo(67);
    assertThat(SubtaskSummary.percentage(1, 8)).isEqualTo(13);
    assertThat(SubtaskSummary.percentage(3, 3)).isEqualTo(100);
  }

  @Test
  void sums_hours_and_never_reports_negative_remaining() {
    var children =
        List.of(
            withEffort(task("a", null, PARENT, TaskStatus.IN_PROGRESS), "4.5", "6"),
            withEffort(task("b", null, PARENT, TaskStatus.DRAFT), "2", null),
            task("c", null, PARENT, TaskStatus.DRAFT));

    var summary = SubtaskSummary.of(PARENT, children);

    assertThat(summary.estimatedHours()).isEqualByComparingTo("6.5");
    assertThat(summary.loggedHours()).isEqualByComparingTo("6");
    assertThat(summary.remainingHours()).isEqualByComparingTo("0.5");

    var overrun =
        SubtaskSummary.of(
            PARENT, List.of(withEffort(task("d", null, PARENT, TaskStatus.REVIEW), "1", "3")));
    assertThat(overrun.remainingHours()).isEqualByComparingTo(BigDecimal.ZERO);
  }
}
