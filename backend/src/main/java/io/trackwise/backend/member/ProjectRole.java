package io.trackwise.backend.member;

/**
 * A member's role within one project, declared from most to least authority. Built-in workflow
 * rules match a required role exactly; project-owned CUSTOM rules accept the required role or any
 * role ranked above it.
 */
public enum ProjectRole {
  /** Full project control. */
  PROJECT_ADMIN(4),
  /** Manages sprints and epics, approves and rejects work. */
  PROJECT_LEAD(3),
  /** Creates and edits assigned tasks. */
  DEVELOPER(2),
  /** Creates issues and comments. */
  REPORTER(1),
  /** Read-only. */
  VIEWER(0);

  private final int authority;

  ProjectRole(int authority) {
    this.authority = authority;
  }

  public int authority() {
    return authority;
  }

  public boolean isAtLeast(ProjectRole other) {
    return authority >= other.authority;
  }
}
