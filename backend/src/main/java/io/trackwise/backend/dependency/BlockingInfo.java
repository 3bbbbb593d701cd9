package io.trackwise.backend.dependency;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;

/**
 * Whether a task can start.
 *
 * @param blockedBy unfinished tasks this task waits for; tasks in a terminal status are left out
 * @param blocking tasks that wait for this task
 * @param reason {@code "Blocked by: <titles>"} while blocked, null otherwise
 */
public record BlockingInfo(
    UUID taskId,
    @JsonProperty("isBlocked") boolean blocked,
    List<LinkedTask> blockedBy,
    List<LinkedTask> blocking,
    boolean canStart,
    String reason) {}
