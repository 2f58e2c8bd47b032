package io.cadence.generator;

import io.cadence.CadenceException;
import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import io.cadence.time.Weekday;

/**
 * Bounds and grouping of a collections traversal.
 *
 * @param start the earliest occurrence, or null
 * @param end the latest occurrence, or null
 * @param take the maximum number of collections, or null
 * @param granularity the period occurrences are grouped by, or null for one collection per
 *     occurrence
 * @param weekStart the first day of the week, used for weekly periods
 * @param skipEmptyPeriods whether periods without occurrences are left out
 */
public record CollectionsArgs(
    DateTime start,
    DateTime end,
    Integer take,
    DateUnit granularity,
    Weekday weekStart,
    boolean skipEmptyPeriods) {

  public CollectionsArgs {
    if (take != null && take < 0) {
      throw CadenceException.config("take must not be negative, got " + take);
    }
    if (weekStart == null) {
      weekStart = Weekday.MO;
    }
  }

  /**
   * Returns arguments grouping by a granularity with no bounds.
   *
   * @param granularity the period, or null for one collection per occurrence
   * @return the arguments
   */
  public static CollectionsArgs of(DateUnit granularity) {
    return new CollectionsArgs(null, null, null, granularity, Weekday.MO, false);
  }

  public CollectionsArgs withStart(DateTime start) {
    return new CollectionsArgs(start, end, take, granularity, weekStart, skipEmptyPeriods);
  }

  public CollectionsArgs withEnd(DateTime end) {
    return new CollectionsArgs(start, end, take, granularity, weekStart, skipEmptyPeriods);
  }

  public CollectionsArgs withTake(Integer take) {
    return new CollectionsArgs(start, end, take, granularity, weekStart, skipEmptyPeriods);
  }

  public CollectionsArgs withWeekStart(Weekday weekStart) {
    return new CollectionsArgs(start, end, take, granularity, weekStart, skipEmptyPeriods);
  }

  public CollectionsArgs withSkipEmptyPeriods(boolean skipEmptyPeriods) {
    return new CollectionsArgs(start, end, take, granularity, weekStart, skipEmptyPeriods);
  }
}
