package io.cadence.rule.pipeline;

import io.cadence.rule.ByDayOfWeek;
import io.cadence.rule.Frequency;
import io.cadence.rule.NormalizedRuleOptions;
import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Restricts the day of the week.
 *
 * <p>For YEARLY rules without a month constraint, ordinals count within the year ({@code 20MO} is
 * the twentieth Monday of the year). For MONTHLY rules, and YEARLY rules with a month constraint,
 * they count within the month. Any other frequency matches plain weekdays and never rejects: the
 * next matching weekday is at most six days away.
 */
public final class DayOfWeekStage implements ConstraintStage {
  private final List<ByDayOfWeek> days;
  private final DateUnit scope;
  private final boolean reverse;

  public DayOfWeekStage(NormalizedRuleOptions options, boolean reverse) {
    this(options.byDayOfWeek(), scopeOf(options), reverse);
  }

  /**
   * Creates a stage with an explicit ordinal scope.
   *
   * @param days the weekdays, non-empty
   * @param scope {@link DateUnit#YEAR}, {@link DateUnit#MONTH}, or null for plain weekdays
   * @param reverse whether the traversal runs backwards
   */
  public DayOfWeekStage(List<ByDayOfWeek> days, DateUnit scope, boolean reverse) {
    if (days.isEmpty()) {
      throw new IllegalArgumentException("a day of week stage needs at least one weekday");
    }
    this.days = List.copyOf(days);
    this.scope = scope;
    this.reverse = reverse;
  }

  private static DateUnit scopeOf(NormalizedRuleOptions options) {
    if (options.hasYearlyWeekdayScope()) {
      return DateUnit.YEAR;
    }
    if (options.frequency() == Frequency.YEARLY || options.frequency() == Frequency.MONTHLY) {
      return DateUnit.MONTH;
    }
    return null;
  }

  @Override
  public StageResult evaluate(DateTime candidate) {
    if (scope == null) {
      return evaluateWeekdays(candidate);
    }
    LocalDate current = candidate.toLocalDateTime().toLocalDate();
    List<LocalDate> matches = resolve(current);
    if (matches.contains(current)) {
      return StageResult.valid();
    }
    if (reverse) {
      for (int i = matches.size() - 1; i >= 0; i--) {
        if (matches.get(i).isBefore(current)) {
          return StageResult.repair(moveTo(candidate, current, matches.get(i)));
        }
      }
    } else {
      for (LocalDate match : matches) {
        if (match.isAfter(current)) {
          return StageResult.repair(moveTo(candidate, current, match));
        }
      }
    }
    return StageResult.reject(scope);
  }

  private StageResult evaluateWeekdays(DateTime candidate) {
    int closest = 7;
    for (ByDayOfWeek day : days) {
      int distance =
          reverse
              ? day.weekday().daysUntil(candidate.weekday())
              : candidate.weekday().daysUntil(day.weekday());
      closest = Math.min(closest, distance);
    }
    if (closest == 0) {
      return StageResult.valid();
    }
    if (reverse) {
      return StageResult.repair(
          candidate.endGranularity(DateUnit.DAY).subtract(closest, DateUnit.DAY));
    }
    return StageResult.repair(candidate.granularity(DateUnit.DAY).add(closest, DateUnit.DAY));
  }

  private DateTime moveTo(DateTime candidate, LocalDate from, LocalDate to) {
    long days = ChronoUnit.DAYS.between(from, to);
    if (reverse) {
      return candidate.endGranularity(DateUnit.DAY).add(days, DateUnit.DAY);
    }
    return candidate.granularity(DateUnit.DAY).add(days, DateUnit.DAY);
  }

  /**
   * Returns the dates matched by this stage within the month or year containing {@code date},
   * ascending.
   *
   * @param date any date in the window
   * @return the matching dates
   */
  List<LocalDate> resolve(LocalDate date) {
    LocalDate first =
        scope == DateUnit.YEAR
            ? date.with(TemporalAdjusters.firstDayOfYear())
            : date.with(TemporalAdjusters.firstDayOfMonth());
    LocalDate last =
        scope == DateUnit.YEAR
            ? date.with(TemporalAdjusters.lastDayOfYear())
            : date.with(TemporalAdjusters.lastDayOfMonth());

    List<LocalDate> matches = new ArrayList<>();
    for (ByDayOfWeek day : days) {
      LocalDate firstMatch = first.with(TemporalAdjusters.nextOrSame(day.weekday().toDayOfWeek()));
      LocalDate lastMatch =
          last.with(TemporalAdjusters.previousOrSame(day.weekday().toDayOfWeek()));
      if (day.nth() == 0) {
        for (LocalDate d = firstMatch; !d.isAfter(last); d = d.plusWeeks(1)) {
          matches.add(d);
        }
      } else {
        LocalDate d =
            day.nth() > 0
                ? firstMatch.plusWeeks(day.nth() - 1L)
                : lastMatch.minusWeeks(-day.nth() - 1L);
        if (!d.isBefore(first) && !d.isAfter(last)) {
          matches.add(d);
        }
      }
    }
    return matches.stream().distinct().sorted().toList();
  }
}
