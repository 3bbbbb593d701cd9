package io.trackwise.backend.dependency;

import java.util.List;
import java.util.UUID;

/**
 * Links of one task, grouped by direction.
 *
 * @param blocking tasks that wait for this task
 * @param blockedBy tasks this task waits for
 * @param relatedTo informational links, either direction
 */
public record TaskDependencies(
    UUID taskId, List<LinkedTask> blocking, List<LinkedTask> blockedBy, List<LinkedTask> relatedTo) {}
