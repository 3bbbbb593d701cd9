package io.trackwise.backend.hierarchy;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits of the task hierarchy. Zero or missing values fall back to the defaults below.
 *
 * @param maxDepth deepest level a task may sit at after a move (root tasks are level 0)
 * @param defaultTreeDepth levels rendered by the tree view when none are requested
 * @param maxTreeDepth most levels a caller may request from the tree view
 * @param ancestorHopLimit bound on parent-pointer walks, guarding against corrupt ancestry
 */
@ConfigurationProperties(prefix = "trackwise.hierarchy")
public record HierarchyProperties(
    int maxDepth, int defaultTreeDepth, int maxTreeDepth, int ancestorHopLimit) {

  public HierarchyProperties {
    maxDepth = maxDepth > 0 ? maxDepth : 10;
    defaultTreeDepth = defaultTreeDepth > 0 ? defaultTreeDepth : 5;
    maxTreeDepth = maxTreeDepth > 0 ? maxTreeDepth : 10;
    ancestorHopLimit = ancestorHopLimit > 0 ? ancestorHopLimit : 20;
  }

  public static HierarchyProperties defaults() {
    return new HierarchyProperties(0, 0, 0, 0);
  }
}
