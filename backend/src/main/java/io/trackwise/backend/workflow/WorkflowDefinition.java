package io.trackwise.backend.workflow;

import io.trackwise.backend.task.TaskStatus;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * The ordered transition table of one workflow. Construction fails when two rules share the same
 * (from, to) pair, so every permitted pair resolves to exactly one rule.
 */
public record WorkflowDefinition(WorkflowType type, List<TransitionRule> transitions) {

  public WorkflowDefinition {
    transitions = List.copyOf(transitions);
    var seen = new HashMap<String, TransitionRule>();
    for (var rule : transitions) {
      var previous = seen.putIfAbsent(rule.from() + "->" + rule.to(), rule);
      if (previous != null) {
        throw new IllegalStateException(
            "Workflow "
                + type
                + " declares "
                + rule.from()
                + " -> "
                + rule.to()
                + " twice ('"
                + previous.name()
                + "' and '"
                + rule.name()
                + "')");
      }
    }
  }

  public String description() {
    return type.description();
  }

  public Optional<TransitionRule> find(TaskStatus from, TaskStatus to) {
    return transitions.stream().filter(rule -> rule.connects(from, to)).findFirst();
  }

  public List<TransitionRule> from(TaskStatus current) {
    return transitions.stream().filter(rule -> rule.from() == current).toList();
  }
}
