package io.trackwise.backend.workflow;

import io.trackwise.backend.task.TaskStatus;
import java.util.UUID;

/** An applied status change. {@code transition} is null when a rule-less CUSTOM project allowed it. */
public record TransitionResult(
    UUID taskId, WorkflowType workflowType, TaskStatus from, TaskStatus to, String transition) {}
