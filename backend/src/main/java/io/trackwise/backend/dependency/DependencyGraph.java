package io.trackwise.backend.dependency;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory snapshot of "depends on" edges (dependent task to blocking task). Only blocking-type
 * links are kept; RELATES_TO never takes part in ordering. Parallel BLOCKS and IS_BLOCKED_BY links
 * between the same pair collapse into one edge.
 */
public final class DependencyGraph {

  private final Map<UUID, List<UUID>> dependsOn;
  private final Set<UUID> nodes;

  private DependencyGraph(Map<UUID, Set<UUID>> adjacency, Set<UUID> nodes) {
    var copy = new LinkedHashMap<UUID, List<UUID>>();
    adjacency.forEach((node, targets) -> copy.put(node, List.copyOf(targets)));
    this.dependsOn = Collections.unmodifiableMap(copy);
    this.nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
  }

  public static DependencyGraph of(Collection<TaskDependency> edges) {
    return builder().addAll(edges).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Tasks the given task waits for. Empty for unknown tasks. */
  public List<UUID> dependenciesOf(UUID taskId) {
    return dependsOn.getOrDefault(taskId, List.of());
  }

  /** Every task that appears on either end of an edge, or was added explicitly. */
  public Set<UUID> nodes() {
    return nodes;
  }

  public static final class Builder {

    private final Map<UUID, Set<UUID>> adjacency = new LinkedHashMap<>();
    private final Set<UUID> nodes = new LinkedHashSet<>();

    private Builder() {}

    public Builder addNode(UUID taskId) {
      nodes.add(taskId);
      return this;
    }

    public Builder addEdge(UUID dependentTaskId, UUID blockingTaskId) {
      nodes.add(dependentTaskId);
      nodes.add(blockingTaskId);
      adjacency.computeIfAbsent(dependentTaskId, k -> new LinkedHashSet<>()).add(blockingTaskId);
      return this;
    }

    public Builder addAll(Collection<TaskDependency> edges) {
      edges.stream()
          .filter(TaskDependency::isBlocking)
          .forEach(edge -> addEdge(edge.getDependentTaskId(), edge.getBlockingTaskId()));
      return this;
    }

    public DependencyGraph build() {
      return new DependencyGraph(adjacency, nodes);
    }
  }
}
