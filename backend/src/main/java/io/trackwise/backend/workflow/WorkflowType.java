package io.trackwise.backend.workflow;

/** Workflow a project runs its tasks through. Chosen per project, BASIC by default. */
public enum WorkflowType {
  BASIC("Simple workflow for small teams: draft, assign, work, review, done"),
  AGILE("Scrum-style workflow with review gating by the project lead"),
  BUG_TRACKING("Issue workflow with triage, fix, verification and rejection"),
  CUSTOM("Project-defined transitions stored with the project");

  private final String description;

  WorkflowType(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }

  /** True when the transition table is owned by the project rather than built in. */
  public boolean isCustom() {
    return this == CUSTOM;
  }
}
