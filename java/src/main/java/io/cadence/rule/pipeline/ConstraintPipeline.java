package io.cadence.rule.pipeline;

import io.cadence.CadenceException;
import io.cadence.rule.NormalizedRuleOptions;
import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import io.cadence.time.Weekday;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the nearest date satisfying every constraint of a rule.
 *
 * <p>Stages run from the coarsest unit to the finest: frequency, month, day of month, day of week,
 * hour, minute, second and millisecond. The first stage to fail decides the next candidate and
 * evaluation starts over from the frequency stage, until every stage accepts the candidate or the
 * candidate passes the bound.
 *
 * <p>A candidate that needs more than {@code maxFailedIterations} consecutive repairs means the
 * constraints cannot be satisfied together (day 31 of February, say) and fails with a
 * {@link io.cadence.ErrorKind#NON_CONVERGENCE} error.
 */
public final class ConstraintPipeline {
  private static final Logger log = LoggerFactory.getLogger(ConstraintPipeline.class);

  private final List<ConstraintStage> stages;
  private final Weekday weekStart;
  private final boolean reverse;
  private final int maxFailedIterations;

  /**
   * Creates a pipeline from explicit stages.
   *
   * @param stages the stages, coarsest first
   * @param weekStart the first day of the week
   * @param reverse whether the traversal runs backwards
   * @param maxFailedIterations the non-convergence bound
   */
  public ConstraintPipeline(
      List<ConstraintStage> stages, Weekday weekStart, boolean reverse, int maxFailedIterations) {
    this.stages = List.copyOf(stages);
    this.weekStart = weekStart;
    this.reverse = reverse;
    this.maxFailedIterations = maxFailedIterations;
  }

  /**
   * Builds the pipeline for a rule.
   *
   * @param options the normalized rule options
   * @param reverse whether the traversal runs backwards
   * @param maxFailedIterations the non-convergence bound
   * @return the pipeline
   */
  public static ConstraintPipeline of(
      NormalizedRuleOptions options, boolean reverse, int maxFailedIterations) {
    List<ConstraintStage> stages = new ArrayList<>();
    stages.add(new FrequencyStage(options, reverse));
    if (!options.byMonthOfYear().isEmpty()) {
      stages.add(FieldStage.month(options.byMonthOfYear(), reverse));
    }
    if (!options.byDayOfMonth().isEmpty()) {
      stages.add(new DayOfMonthStage(options.byDayOfMonth(), reverse));
    }
    if (!options.byDayOfWeek().isEmpty()) {
      stages.add(new DayOfWeekStage(options, reverse));
    }
    if (!options.byHourOfDay().isEmpty()) {
      stages.add(FieldStage.hour(options.byHourOfDay(), reverse));
    }
    if (!options.byMinuteOfHour().isEmpty()) {
      stages.add(FieldStage.minute(options.byMinuteOfHour(), reverse));
    }
    if (!options.bySecondOfMinute().isEmpty()) {
      stages.add(FieldStage.second(options.bySecondOfMinute(), reverse));
    }
    if (!options.byMillisecondOfSecond().isEmpty()) {
      stages.add(FieldStage.millisecond(options.byMillisecondOfSecond(), reverse));
    }
    return new ConstraintPipeline(stages, options.weekStart(), reverse, maxFailedIterations);
  }

  /**
   * Returns the first date at or after {@code candidate} (at or before, in reverse) that satisfies
   * every stage.
   *
   * @param candidate the date to start searching from
   * @param bound the last acceptable date in the traversal direction, or null for none
   * @return the matching date, or empty once the search passes {@code bound}
   * @throws CadenceException if no date is found within the iteration bound
   */
  public Optional<DateTime> resolve(DateTime candidate, DateTime bound) {
    DateTime date = candidate;
    int failures = 0;

    search:
    while (true) {
      if (bound != null && (reverse ? date.isBefore(bound) : date.isAfter(bound))) {
        return Optional.empty();
      }
      for (ConstraintStage stage : stages) {
        StageResult result = stage.evaluate(date);
        if (result instanceof StageResult.Valid) {
          continue;
        }
        if (++failures > maxFailedIterations) {
          throw CadenceException.nonConvergence(
              "no date satisfying the rule was found after "
                  + maxFailedIterations
                  + " iterations, last candidate "
                  + date,
              date);
        }
        DateTime next =
            result instanceof StageResult.Repair repair
                ? repair.date()
                : ascend(date, ((StageResult.Reject) result).parent());
        log.trace("{} moved candidate {} to {}", stage.getClass().getSimpleName(), date, next);
        date = next;
        continue search;
      }
      return Optional.of(date);
    }
  }

  /**
   * Moves a candidate to the start of the next {@code parent} window, or to the end of the
   * previous one in reverse.
   *
   * @param date the rejected candidate
   * @param parent the window to leave
   * @return the candidate in the adjacent window
   */
  public DateTime ascend(DateTime date, DateUnit parent) {
    DateTime windowStart = date.granularity(parent, weekStart);
    return reverse
        ? windowStart.subtract(1, DateUnit.MILLISECOND)
        : windowStart.add(1, parent);
  }
}
