package io.trackwise.backend.dependency;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads the part of the stored graph that cycle checks need. Reachable subgraphs are fetched one
 * BFS level per query, never one query per task.
 */
@Component
public class DependencyGraphLoader {

  private static final Logger log = LoggerFactory.getLogger(DependencyGraphLoader.class);

  private final TaskDependencyRepository dependencyRepository;

  public DependencyGraphLoader(TaskDependencyRepository dependencyRepository) {
    this.dependencyRepository = dependencyRepository;
  }

  /** Every blocking edge reachable from {@code startTaskId} along "depends on" edges. */
  public DependencyGraph loadReachableFrom(UUID startTaskId) {
    var builder = DependencyGraph.builder().addNode(startTaskId);
    Set<UUID> seen = new HashSet<>();
    seen.add(startTaskId);
    Set<UUID> frontier = Set.of(startTaskId);
    int levels = 0;

    while (!frontier.isEmpty()) {
      var edges =
          dependencyRepository.findByDependentIdsAndTypes(frontier, DependencyType.BLOCKING_TYPES);
      builder.addAll(edges);
      Set<UUID> next = new HashSet<>();
      for (var edge : edges) {
        if (seen.add(edge.getBlockingTaskId())) {
          next.add(edge.getBlockingTaskId());
        }
      }
      frontier = next;
      levels++;
    }

    log.debug("Loaded {} tasks reachable from {} in {} queries", seen.size(), startTaskId, levels);
    return builder.build();
  }
}
