package io.trackwise.backend.hierarchy;

import io.trackwise.backend.task.Task;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Parent/children index over every task of one scope (a project, or all project-less tasks),
 * built from a single query. Parent pointers leading outside the scope are treated as roots.
 */
final class TaskHierarchy {

  private final Map<UUID, Task> tasks = new HashMap<>();
  private final Map<UUID, List<Task>> children = new HashMap<>();
  private final int hopLimit;

  TaskHierarchy(Collection<Task> scope, int hopLimit) {
    this.hopLimit = hopLimit;
    scope.forEach(task -> tasks.put(task.getId(), task));
    for (var task : scope) {
      if (task.getParentId() != null && tasks.containsKey(task.getParentId())) {
        children.computeIfAbsent(task.getParentId(), k -> new ArrayList<>()).add(task);
      }
    }
    children.values().forEach(list -> list.sort(Comparator.comparing(Task::getCreatedAt)));
  }

  Task get(UUID taskId) {
    return tasks.get(taskId);
  }

  /** Direct children, oldest first. */
  List<Task> childrenOf(UUID taskId) {
    return children.getOrDefault(taskId, List.of());
  }

  /** Ancestor hops up to the root, never more than the hop limit. */
  int depthOf(UUID taskId) {
    int depth = 0;
    var current = tasks.get(taskId);
    while (current != null && current.getParentId() != null && depth < hopLimit) {
      current = tasks.get(current.getParentId());
      if (current == null) {
        break;
      }
      depth++;
    }
    return depth;
  }

  /** True when {@code ancestorId} appears among the ancestors of {@code taskId}. */
  boolean isAncestor(UUID ancestorId, UUID taskId) {
    var current = tasks.get(taskId);
    int hops = 0;
    while (current != null && current.getParentId() != null && hops < hopLimit) {
      if (current.getParentId().equals(ancestorId)) {
        return true;
      }
      current = tasks.get(current.getParentId());
      hops++;
    }
    return false;
  }

  /** Levels below the task: 0 for a leaf, 1 when it only has children, and so on. */
  int subtreeHeight(UUID taskId) {
    Set<UUID> seen = new HashSet<>();
    seen.add(taskId);
    List<UUID> level = List.of(taskId);
    int height = -1;
    while (!level.isEmpty() && height < hopLimit) {
      height++;
      var next = new ArrayList<UUID>();
      for (var id : level) {
        for (var child : childrenOf(id)) {
          if (seen.add(child.getId())) {
            next.add(child.getId());
          }
        }
      }
      level = next;
    }
    return height;
  }
}
