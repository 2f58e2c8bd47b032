package io.cadence.rule.pipeline;

import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;

/** The outcome of evaluating one constraint stage against a candidate date. */
public sealed interface StageResult
    permits StageResult.Valid, StageResult.Repair, StageResult.Reject {

  /** The candidate satisfies the stage. */
  record Valid() implements StageResult {}

  /**
   * The candidate fails the stage; {@code date} is the nearest date in the traversal direction that
   * could satisfy it.
   *
   * @param date the repaired candidate
   */
  record Repair(DateTime date) implements StageResult {}

  /**
   * No date in the candidate's enclosing {@code parent} window satisfies the stage; the search
   * continues in the adjacent parent window.
   *
   * @param parent the window to leave
   */
  record Reject(DateUnit parent) implements StageResult {}

  static StageResult valid() {
    return new Valid();
  }

  static StageResult repair(DateTime date) {
    return new Repair(date);
  }

  static StageResult reject(DateUnit parent) {
    return new Reject(parent);
  }
}
