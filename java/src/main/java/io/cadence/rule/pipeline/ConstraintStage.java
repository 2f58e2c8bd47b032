package io.cadence.rule.pipeline;

import io.cadence.time.DateTime;

/** One constraint of a rule, checked against a candidate date. */
public interface ConstraintStage {
  /**
   * Evaluates a candidate. A repaired date is never on the far side of a valid date.
   *
   * @param candidate the candidate date
   * @return whether the candidate is valid, and if not where to continue
   */
  StageResult evaluate(DateTime candidate);
}
