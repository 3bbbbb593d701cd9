package io.trackwise.backend.dependency;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Cycle checks over a {@link DependencyGraph}. Both searches are iterative depth-first traversals
 * with an explicit stack, so long chains cannot overflow the thread stack. Each runs in O(V + E).
 */
public final class CycleDetector {

  private CycleDetector() {}

  /**
   * Checks whether adding the edge {@code dependentId -> blockingId} would close a cycle.
   *
   * <p>Walks "depends on" edges from the blocking task. Reaching the dependent task means the new
   * edge closes a loop; the returned path then starts and ends with the dependent task, e.g. {@code
   * [A, B, C, A]}. Running into a node that is already on the current path means the stored graph
   * holds a cycle of its own; that path is reported as well and ends with the repeated node.
   *
   * @return the cycle path, or empty when the edge keeps the graph acyclic
   */
  public static Optional<List<UUID>> findCycle(
      DependencyGraph graph, UUID dependentId, UUID blockingId) {
    if (dependentId.equals(blockingId)) {
      return Optional.of(List.of(dependentId, dependentId));
    }

    Set<UUID> visited = new HashSet<>();
    Set<UUID> onPath = new HashSet<>();
    List<UUID> path = new ArrayList<>();
    Deque<Frame> stack = new ArrayDeque<>();

    visited.add(blockingId);
    onPath.add(blockingId);
    path.add(blockingId);
    stack.push(new Frame(blockingId, graph.dependenciesOf(blockingId).iterator()));

    while (!stack.isEmpty()) {
      var frame = stack.peek();
      if (!frame.remaining().hasNext()) {
        stack.pop();
        onPath.remove(path.remove(path.size() - 1));
        continue;
      }
      var next = frame.remaining().next();
      if (next.equals(dependentId)) {
        return Optional.of(closedPath(dependentId, path, dependentId));
      }
      if (onPath.contains(next)) {
        return Optional.of(closedPath(dependentId, path, next));
      }
      if (visited.add(next)) {
        onPath.add(next);
        path.add(next);
        stack.push(new Frame(next, graph.dependenciesOf(next).iterator()));
      }
    }
    return Optional.empty();
  }

  /**
   * Lists the cycles present in the graph, one per back edge met by a white/gray/black depth-first
   * search. Each cycle is a closed path ({@code [A, B, A]}); the same loop is never reported twice.
   * Diagnostic only: a graph maintained through {@link #findCycle} has none.
   */
  public static List<List<UUID>> findAllCycles(DependencyGraph graph) {
    Map<UUID, Mark> marks = new HashMap<>();
    Map<List<UUID>, List<UUID>> cycles = new LinkedHashMap<>();

    for (var start : graph.nodes()) {
      if (marks.containsKey(start)) {
        continue;
      }
      List<UUID> path = new ArrayList<>();
      Deque<Frame> stack = new ArrayDeque<>();
      marks.put(start, Mark.VISITING);
      path.add(start);
      stack.push(new Frame(start, graph.dependenciesOf(start).iterator()));

      while (!stack.isEmpty()) {
        var frame = stack.peek();
        if (!frame.remaining().hasNext()) {
          stack.pop();
          marks.put(frame.node(), Mark.DONE);
          path.remove(path.size() - 1);
          continue;
        }
        var next = frame.remaining().next();
        var mark = marks.get(next);
        if (mark == null) {
          marks.put(next, Mark.VISITING);
          path.add(next);
          stack.push(new Frame(next, graph.dependenciesOf(next).iterator()));
        } else if (mark == Mark.VISITING) {
          var loop = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
          var closed = new ArrayList<>(loop);
          closed.add(next);
          cycles.putIfAbsent(canonical(loop), List.copyOf(closed));
        }
      }
    }
    return List.copyOf(cycles.values());
  }

  private static List<UUID> closedPath(UUID first, List<UUID> path, UUID last) {
    var cycle = new ArrayList<UUID>(path.size() + 2);
    cycle.add(first);
    cycle.addAll(path);
    cycle.add(last);
    return List.copyOf(cycle);
  }

  /** Rotation of an open loop starting at its smallest id. */
  private static List<UUID> canonical(List<UUID> loop) {
    var smallest = loop.stream().min(Comparator.naturalOrder()).orElseThrow();
    int offset = loop.indexOf(smallest);
    var rotated = new ArrayList<UUID>(loop.size());
    for (int i = 0; i < loop.size(); i++) {
      rotated.add(loop.get((offset + i) % loop.size()));
    }
    return rotated;
  }

  private enum Mark {
    VISITING,
    DONE
  }

  private record Frame(UUID node, Iterator<UUID> remaining) {}
}
