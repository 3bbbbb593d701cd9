package io.trackwise.backend.dependency;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.trackwise.backend.dependency.BulkDependencyService.Item;
import io.trackwise.backend.dependency.BulkDependencyService.Operation;
import io.trackwise.backend.exception.CircularDependencyException;
import io.trackwise.backend.exception.ResourceNotFoundException;
import io.trackwise.backend.task.TaskStatus;
import io.trackwise.backend.task.TaskSummary;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

@ExtendWith(MockitoExtension.class)
class BulkDependencyServiceTest {

  private static final UUID A = UUID.randomUUID();
  private static final UUID B = UUID.randomUUID();
  private static final UUID C = UUID.randomUUID();

  @Mock(strictness = Mock.Strictness.LENIENT)
  private TaskDependencyService dependencyService;

  private BulkDependencyService bulkService;

  @BeforeEach
  void setUp() {
    bulkService = new BulkDependencyService(dependencyService);
  }

  @Test
  void create_collects_created_edges_and_refused_cycles() {
    var stored = response(A, B);
    when(dependencyService.createDependency(A, B, DependencyType.BLOCKS)).thenReturn(stored);
    when(dependencyService.createDependency(B, A, DependencyType.IS_BLOCKED_BY))
        .thenThrow(new CircularDependencyException(List.of(B, A, B)));

    var result =
        bulkService.apply(
            Operation.CREATE,
            List.of(
                new Item(null, A, B, null),
                new Item(null, B, A, DependencyType.IS_BLOCKED_BY),
                new Item(null, A, null, null)));

    assertThat(result.created()).containsExactly(stored);
    assertThat(result.deleted()).isEmpty();
    assertThat(result.cycles()).containsExactly(List.of(B, A, B));
    assertThat(result.failed())
        .extracting(BulkDependencyService.Failure::index, BulkDependencyService.Failure::title)
        .containsExactly(
            tuple(1, "Circular dependency"),
            tuple(2, "Invalid item"));
  }

  @Test
  void delete_collects_removed_ids() {
    var gone = UUID.randomUUID();
    var missing = UUID.randomUUID();
    doThrow(new ResourceNotFoundException("TaskDependency", missing))
        .when(dependencyService)
        .deleteDependency(missing);

    var result =
        bulkService.apply(
            Operation.DELETE,
            List.of(new Item(gone, null, null, null), new Item(missing, C, A, null)));

    verify(dependencyService).deleteDependency(gone);
    assertThat(result.deleted()).containsExactly(gone);
    assertThat(result.created()).isEmpty();
    assertThat(result.failed())
        .singleElement()
        .extracting(BulkDependencyService.Failure::index)
        .isEqualTo(1);
  }

  @Test
  void concurrent_conflict_fails_only_that_item() {
    when(dependencyService.createDependency(A, C, DependencyType.BLOCKS))
        .thenThrow(new CannotAcquireLockException("could not serialize access"));

    var result = bulkService.apply(Operation.CREATE, List.of(new Item(null, A, C, null)));

    assertThat(result.created()).isEmpty();
    assertThat(result.failed())
        .singleElement()
        .extracting(BulkDependencyService.Failure::title)
        .isEqualTo("Concurrent modification");
  }

  @Test
  void item_without_required_id_never_reaches_the_service() {
    var result = bulkService.apply(Operation.DELETE, List.of(new Item(null, A, B, null)));

    verifyNoInteractions(dependencyService);
    assertThat(result.failed())
        .singleElement()
        .extracting(BulkDependencyService.Failure::detail)
        .isEqualTo("dependencyId is required");
  }

  private static DependencyResponse response(UUID dependent, UUID blocking) {
    return new DependencyResponse(
        UUID.randomUUID(),
        DependencyType.BLOCKS,
        new TaskSummary(dependent, "TRK-1", "Dependent", TaskStatus.DRAFT),
        new TaskSummary(blocking, "TRK-2", "Blocking", TaskStatus.DRAFT),
        Instant.parse("2026-01-01T00:00:00Z"));
  }
}
