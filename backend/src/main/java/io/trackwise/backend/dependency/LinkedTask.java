package io.trackwise.backend.dependency;

import io.trackwise.backend.task.TaskSummary;
import java.util.UUID;

/** The task on the far end of a dependency, as seen from the task being inspected. */
public record LinkedTask(UUID dependencyId, DependencyType type, TaskSummary task) {}
