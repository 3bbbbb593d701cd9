package io.trackwise.backend.workflow;

/**
 * Outcome of evaluating one requested status change.
 *
 * @param allowed whether the change may be applied
 * @param rule the matching rule, null when no rule covers the pair or the workflow is deferred
 * @param reason why the change was refused; null when allowed
 */
public record TransitionCheck(boolean allowed, TransitionRule rule, String reason) {

  static TransitionCheck permitted(TransitionRule rule) {
    return new TransitionCheck(true, rule, null);
  }

  static TransitionCheck refused(TransitionRule rule, String reason) {
    return new TransitionCheck(false, rule, reason);
  }
}
