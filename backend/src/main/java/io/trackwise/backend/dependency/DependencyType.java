package io.trackwise.backend.dependency;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kind of link between two tasks. BLOCKS and IS_BLOCKED_BY both mean the dependent task waits for
 * the blocking task; the type only records from which side the link was declared. RELATES_TO is
 * informational and takes no part in blocking or cycle checks.
 */
public enum DependencyType {
  BLOCKS,
  IS_BLOCKED_BY,
  RELATES_TO;

  public static final Set<DependencyType> BLOCKING_TYPES = EnumSet.of(BLOCKS, IS_BLOCKED_BY);

  public boolean isBlocking() {
    return this != RELATES_TO;
  }
}
