package io.trackwise.backend.workflow;

import io.trackwise.backend.member.ProjectRole;

/** How a caller's project role is compared with the role a transition rule requires. */
public enum RoleMatch {
  /** The caller must hold exactly the required role. Used by the built-in workflows. */
  EXACT,
  /** The required role or any role with more authority. Used by project-owned CUSTOM rules. */
  AT_LEAST;

  public static RoleMatch forWorkflow(WorkflowType type) {
    return type.isCustom() ? AT_LEAST : EXACT;
  }

  /** A null caller role never satisfies a required role. */
  public boolean accepts(ProjectRole required, ProjectRole actual) {
    if (required == null) {
      return true;
    }
    if (actual == null) {
      return false;
    }
    return this == EXACT ? actual == required : actual.isAtLeast(required);
  }
}
