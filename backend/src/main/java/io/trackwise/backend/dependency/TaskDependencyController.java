package io.trackwise.backend.dependency;

import io.trackwise.backend.dependency.BulkDependencyService.Item;
import io.trackwise.backend.dependency.BulkDependencyService.Operation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskDependencyController {

  private final TaskDependencyService dependencyService;
  private final BulkDependencyService bulkDependencyService;

  public TaskDependencyController(
      TaskDependencyService dependencyService, BulkDependencyService bulkDependencyService) {
    this.dependencyService = dependencyService;
    this.bulkDependencyService = bulkDependencyService;
  }

  @PostMapping("/api/task-dependencies")
  public ResponseEntity<DependencyResponse> createDependency(
      @Valid @RequestBody CreateDependencyRequest request) {
    var created =
        dependencyService.createDependency(
            request.dependentTaskId(),
            request.blockingTaskId(),
            request.type() != null ? request.type() : DependencyType.BLOCKS);
    return ResponseEntity.created(URI.create("/api/task-dependencies/" + created.id()))
        .body(created);
  }

  @GetMapping("/api/task-dependencies")
  public ResponseEntity<List<DependencyResponse>> listDependencies(
      @RequestParam(required = false) UUID taskId,
      @RequestParam(required = false) UUID projectId,
      @RequestParam(required = false) DependencyType type) {
    return ResponseEntity.ok(dependencyService.listDependencies(taskId, projectId, type));
  }

  @PostMapping("/api/task-dependencies/bulk")
  public ResponseEntity<BulkDependencyService.Result> bulk(
      @Valid @RequestBody BulkDependencyRequest request) {
    return ResponseEntity.ok(bulkDependencyService.apply(request.operation(), request.items()));
  }

  @DeleteMapping("/api/task-dependencies/{id}")
  public ResponseEntity<Void> deleteDependency(@PathVariable UUID id) {
    dependencyService.deleteDependency(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/tasks/{taskId}/dependencies")
  public ResponseEntity<TaskDependencies> getTaskDependencies(@PathVariable UUID taskId) {
    return ResponseEntity.ok(dependencyService.getTaskDependencies(taskId));
  }

  @GetMapping("/api/tasks/{taskId}/blocking-info")
  public ResponseEntity<BlockingInfo> getBlockingInfo(@PathVariable UUID taskId) {
    return ResponseEntity.ok(dependencyService.getBlockingInfo(taskId));
  }

  @GetMapping("/api/tasks/{taskId}/subtask-summary")
  public ResponseEntity<SubtaskSummary> getSubtaskSummary(@PathVariable UUID taskId) {
    return ResponseEntity.ok(dependencyService.getSubtaskSummary(taskId));
  }

  @GetMapping("/api/projects/{projectId}/dependency-graph")
  public ResponseEntity<DependencyGraphView> getDependencyGraph(@PathVariable UUID projectId) {
    return ResponseEntity.ok(dependencyService.generateDependencyGraph(projectId));
  }

  // --- DTOs ---

  /** {@code type} defaults to BLOCKS. */
  public record CreateDependencyRequest(
      @NotNull(message = "dependentTaskId is required") UUID dependentTaskId,
      @NotNull(message = "blockingTaskId is required") UUID blockingTaskId,
      DependencyType type) {}

  public record BulkDependencyRequest(
      @NotNull(message = "operation is required") Operation operation,
      @NotEmpty(message = "items must not be empty")
          @Size(max = 100, message = "at most 100 items per request")
          List<@NotNull Item> items) {}
}
