package io.trackwise.backend.hierarchy;

import io.trackwise.backend.task.TaskSummary;
import java.util.List;

/**
 * One node of a rendered task tree.
 *
 * @param depth levels below the requested root, which is 0
 * @param hasChildren true whenever the task has children, including at the depth bound where
 *     {@code children} is left empty
 * @param completionPercentage share of terminal direct children; for leaves 100 when terminal,
 *     else 0
 */
public record TaskTreeNode(
    TaskSummary task,
    int depth,
    boolean hasChildren,
    int completionPercentage,
    List<TaskTreeNode> children) {}
