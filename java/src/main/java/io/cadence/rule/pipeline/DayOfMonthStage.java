package io.cadence.rule.pipeline;

import io.cadence.time.Calendars;
import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import java.util.List;

/**
 * Restricts the day of the month. Negative values count back from the end of the month, so -1 is
 * the 31st of January and the 28th or 29th of February.
 */
public final class DayOfMonthStage implements ConstraintStage {
  private final List<Integer> days;
  private final boolean reverse;

  public DayOfMonthStage(List<Integer> days, boolean reverse) {
    if (days.isEmpty()) {
      throw new IllegalArgumentException("a day of month stage needs at least one day");
    }
    this.days = List.copyOf(days);
    this.reverse = reverse;
  }

  @Override
  public StageResult evaluate(DateTime candidate) {
    List<Integer> resolved = resolve(candidate.year(), candidate.month());
    int current = candidate.day();
    if (resolved.contains(current)) {
      return StageResult.valid();
    }
    if (reverse) {
      for (int i = resolved.size() - 1; i >= 0; i--) {
        if (resolved.get(i) < current) {
          return StageResult.repair(
              candidate.granularity(DateUnit.DAY)
                  .set(DateUnit.DAY, resolved.get(i))
                  .endGranularity(DateUnit.DAY));
        }
      }
    } else {
      for (int day : resolved) {
        if (day > current) {
          return StageResult.repair(candidate.granularity(DateUnit.DAY).set(DateUnit.DAY, day));
        }
      }
    }
    return StageResult.reject(DateUnit.MONTH);
  }

  /**
   * Returns the days of a month matched by this stage, ascending. Days that do not exist in the
   * month, e.g. 31 in April, are dropped.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return the matching days
   */
  public List<Integer> resolve(int year, int month) {
    int length = Calendars.monthLength(year, month);
    return days.stream()
        .map(day -> day > 0 ? day : length + 1 + day)
        .filter(day -> day >= 1 && day <= length)
        .distinct()
        .sorted()
        .toList();
  }
}
