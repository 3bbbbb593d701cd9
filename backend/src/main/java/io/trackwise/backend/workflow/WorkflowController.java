package io.trackwise.backend.workflow;

import io.trackwise.backend.member.ProjectRole;
import io.trackwise.backend.security.CurrentMember;
import io.trackwise.backend.task.TaskStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkflowController {

  private final TransitionValidator validator;
  private final TaskTransitionService transitionService;

  public WorkflowController(TransitionValidator validator, TaskTransitionService transitionService) {
    this.validator = validator;
    this.transitionService = transitionService;
  }

  @GetMapping("/api/workflows/{type}")
  public ResponseEntity<WorkflowResponse> describe(@PathVariable WorkflowType type) {
    return ResponseEntity.ok(WorkflowResponse.from(transitionService.describe(type)));
  }

  @GetMapping("/api/workflows/{type}/transitions")
  public ResponseEntity<List<TransitionRule>> availableTransitions(
      @PathVariable WorkflowType type,
      @RequestParam TaskStatus from,
      @RequestParam(required = false) ProjectRole role) {
    return ResponseEntity.ok(validator.getAvailableTransitions(type, from, role));
  }

  @GetMapping("/api/workflows/{type}/transitions/check")
  public ResponseEntity<TransitionCheckResponse> checkTransition(
      @PathVariable WorkflowType type,
      @RequestParam TaskStatus from,
      @RequestParam TaskStatus to,
      @RequestParam(required = false) ProjectRole role) {
    return ResponseEntity.ok(
        new TransitionCheckResponse(
            type, from, to, role, validator.isTransitionAllowed(type, from, to, role)));
  }

  @GetMapping("/api/tasks/{taskId}/transitions")
  public ResponseEntity<List<TransitionRule>> taskTransitions(@PathVariable UUID taskId) {
    return ResponseEntity.ok(
        transitionService.availableTransitions(taskId, CurrentMember.require()));
  }

  @PostMapping("/api/tasks/{taskId}/transition")
  public ResponseEntity<TransitionResult> transition(
      @PathVariable UUID taskId, @Valid @RequestBody TransitionRequest request) {
    return ResponseEntity.ok(
        transitionService.changeStatus(taskId, request.status(), CurrentMember.require()));
  }

  // --- DTOs ---

  public record TransitionRequest(@NotNull(message = "status is required") TaskStatus status) {}

  public record TransitionCheckResponse(
      WorkflowType workflowType,
      TaskStatus from,
      TaskStatus to,
      ProjectRole role,
      boolean allowed) {}

  public record WorkflowResponse(
      WorkflowType type, String description, List<TransitionRule> transitions) {

    static WorkflowResponse from(WorkflowDefinition definition) {
      return new WorkflowResponse(
          definition.type(), definition.description(), definition.transitions());
    }
  }
}
