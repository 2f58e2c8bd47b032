package io.cadence.rule.pipeline;

import io.cadence.rule.NormalizedRuleOptions;
import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import io.cadence.time.Weekday;

/**
 * Accepts candidates that fall in a frequency window aligned with the rule's interval.
 *
 * <p>Windows are counted from the window containing the rule's start, so with a MONTHLY interval of
 * 3 starting in January only January, April, July and October windows are valid.
 */
public final class FrequencyStage implements ConstraintStage {
  private final DateUnit unit;
  private final int interval;
  private final Weekday weekStart;
  private final DateTime origin;
  private final boolean reverse;

  public FrequencyStage(NormalizedRuleOptions options, boolean reverse) {
    this.unit = options.frequency().unit();
    this.interval = options.interval();
    this.weekStart = options.weekStart();
    this.origin = options.start().granularity(unit, weekStart);
    this.reverse = reverse;
  }

  @Override
  public StageResult evaluate(DateTime candidate) {
    long diff = windowsBetween(origin, candidate.granularity(unit, weekStart));
    long remainder = Math.floorMod(diff, (long) interval);
    if (remainder == 0) {
      return StageResult.valid();
    }
    if (reverse) {
      return StageResult.repair(
          origin.add(diff - remainder, unit).endGranularity(unit, weekStart));
    }
    return StageResult.repair(origin.add(diff - remainder + interval, unit));
  }

  private long windowsBetween(DateTime from, DateTime to) {
    return switch (unit) {
      case YEAR -> to.year() - from.year();
      case MONTH -> (to.year() - from.year()) * 12L + (to.month() - from.month());
      default -> Math.floorDiv(to.timestamp() - from.timestamp(), unit.millis());
    };
  }
}
