package io.trackwise.backend.hierarchy;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskHierarchyController {

  private final TaskHierarchyService hierarchyService;

  public TaskHierarchyController(TaskHierarchyService hierarchyService) {
    this.hierarchyService = hierarchyService;
  }

  @GetMapping("/api/tasks/{taskId}/tree")
  public ResponseEntity<TaskTreeNode> getTaskTree(
      @PathVariable UUID taskId, @RequestParam(required = false) Integer maxDepth) {
    return ResponseEntity.ok(hierarchyService.buildTaskTree(taskId, maxDepth));
  }

  @PutMapping("/api/tasks/{taskId}/parent")
  public ResponseEntity<TaskPlacement> moveTask(
      @PathVariable UUID taskId, @RequestBody MoveTaskRequest request) {
    return ResponseEntity.ok(hierarchyService.moveTask(taskId, request.newParentId()));
  }

  /** A null {@code newParentId} moves the task to root level. */
  public record MoveTaskRequest(UUID newParentId) {}
}
