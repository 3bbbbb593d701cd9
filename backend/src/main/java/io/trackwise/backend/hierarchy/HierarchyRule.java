package io.trackwise.backend.hierarchy;

/** Parent/child rule a refused move broke. */
public enum HierarchyRule {
  /** The new parent is the task itself or one of its descendants. */
  CIRCULAR_REFERENCE,
  /** The new parent belongs to a different project. */
  CROSS_PROJECT,
  /** The deepest moved task would sit below the configured depth limit. */
  MAX_DEPTH_EXCEEDED
}
