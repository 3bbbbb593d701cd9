package io.trackwise.backend.hierarchy;

import java.util.UUID;

/** Where a task sits after a move. {@code newParentId} is null at root level. */
public record TaskPlacement(UUID taskId, UUID oldParentId, UUID newParentId, int depth) {}
