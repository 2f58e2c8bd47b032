package io.cadence.rule;

import io.cadence.CadenceConfig;
import io.cadence.CadenceException;
import io.cadence.time.Calendars;
import io.cadence.time.DateTime;
import io.cadence.time.Weekday;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The validated and defaulted form of {@link RuleOptions}.
 *
 * <p>Every constraint the constraint pipeline evaluates is explicit here: a time-of-day list that
 * was not provided holds the start's value for every unit coarser than the frequency, and a
 * day-level constraint is derived from the start when none was given. Lists are sorted ascending
 * and free of duplicates. A list that is empty leaves its unit unconstrained.
 *
 * @param frequency the base period
 * @param start the first candidate
 * @param interval the number of periods between occurrences, at least 1
 * @param end the last possible occurrence, or null
 * @param count the maximum number of occurrences, or null
 * @param weekStart the first day of the week
 * @param duration the duration in milliseconds given to every occurrence
 * @param byMonthOfYear months (1-12)
 * @param byDayOfMonth days of month
 * @param byDayOfWeek weekdays
 * @param byHourOfDay hours
 * @param byMinuteOfHour minutes
 * @param bySecondOfMinute seconds
 * @param byMillisecondOfSecond milliseconds
 */
public record NormalizedRuleOptions(
    Frequency frequency,
    DateTime start,
    int interval,
    DateTime end,
    Integer count,
    Weekday weekStart,
    long duration,
    List<Integer> byMonthOfYear,
    List<Integer> byDayOfMonth,
    List<ByDayOfWeek> byDayOfWeek,
    List<Integer> byHourOfDay,
    List<Integer> byMinuteOfHour,
    List<Integer> bySecondOfMinute,
    List<Integer> byMillisecondOfSecond) {

  /**
   * Validates and normalizes provided options.
   *
   * @param options the provided options
   * @param config the engine configuration supplying the default week start
   * @return the normalized options
   * @throws CadenceException if the options are invalid or use an unsupported constraint
   */
  public static NormalizedRuleOptions normalize(RuleOptions options, CadenceConfig config) {
    if (options.frequency() == null) {
      throw CadenceException.config("frequency is required");
    }
    if (options.start() == null) {
      throw CadenceException.config("start is required");
    }
    rejectUnsupported("byWeekOfYear", options.byWeekOfYear());
    rejectUnsupported("byDayOfYear", options.byDayOfYear());
    rejectUnsupported("byPosition", options.byPosition());

    Frequency frequency = options.frequency();
    DateTime start = options.start();

    int interval = options.interval() == null ? 1 : options.interval();
    if (interval < 1) {
      throw CadenceException.config("interval must be a positive integer, got " + interval);
    }
    if (options.count() != null && options.count() < 1) {
      throw CadenceException.config("count must be a positive integer, got " + options.count());
    }
    if (options.end() != null && options.count() != null) {
      throw CadenceException.config("end and count cannot both be set");
    }
    if (options.end() != null
        && !Objects.equals(options.end().timezone(), start.timezone())) {
      throw CadenceException.config(
          "end must have the start's timezone ("
              + start.timezone()
              + "), got "
              + options.end().timezone());
    }
    long duration = options.duration() == null ? 0 : options.duration();
    if (duration < 0) {
      throw CadenceException.config("duration must be a non-negative number of milliseconds");
    }
    Weekday weekStart =
        options.weekStart() == null ? config.defaultWeekStart() : options.weekStart();

    List<Integer> byMonthOfYear = checkRange("byMonthOfYear", options.byMonthOfYear(), 1, 12);
    List<Integer> byDayOfMonth = checkDaysOfMonth(frequency, options.byDayOfMonth());
    List<ByDayOfWeek> byDayOfWeek =
        checkDaysOfWeek(frequency, !byMonthOfYear.isEmpty(), weekStart, options.byDayOfWeek());
    List<Integer> byHourOfDay = checkRange("byHourOfDay", options.byHourOfDay(), 0, 23);
    List<Integer> byMinuteOfHour = checkRange("byMinuteOfHour", options.byMinuteOfHour(), 0, 59);
    List<Integer> bySecondOfMinute =
        checkRange("bySecondOfMinute", options.bySecondOfMinute(), 0, 59);
    List<Integer> byMillisecondOfSecond =
        checkRange("byMillisecondOfSecond", options.byMillisecondOfSecond(), 0, 999);

    // Time-of-day units coarser than the frequency default to the start's value.
    if (byMillisecondOfSecond.isEmpty()) {
      byMillisecondOfSecond = List.of(start.millisecond());
    }
    if (bySecondOfMinute.isEmpty() && Frequency.SECONDLY.isFinerThan(frequency)) {
      bySecondOfMinute = List.of(start.second());
    }
    if (byMinuteOfHour.isEmpty() && Frequency.MINUTELY.isFinerThan(frequency)) {
      byMinuteOfHour = List.of(start.minute());
    }
    if (byHourOfDay.isEmpty() && Frequency.HOURLY.isFinerThan(frequency)) {
      byHourOfDay = List.of(start.hour());
    }

    boolean noDayConstraint = byDayOfMonth.isEmpty() && byDayOfWeek.isEmpty();
    if (frequency == Frequency.YEARLY && noDayConstraint && byMonthOfYear.isEmpty()) {
      byMonthOfYear = List.of(start.month());
    }
    if ((frequency == Frequency.YEARLY || frequency == Frequency.MONTHLY) && noDayConstraint) {
      byDayOfMonth = List.of(start.day());
    }
    if (frequency == Frequency.WEEKLY && byDayOfWeek.isEmpty()) {
      byDayOfWeek = List.of(ByDayOfWeek.of(start.weekday()));
    }

    return new NormalizedRuleOptions(
        frequency,
        start,
        interval,
        options.end(),
        options.count(),
        weekStart,
        duration,
        byMonthOfYear,
        byDayOfMonth,
        byDayOfWeek,
        byHourOfDay,
        byMinuteOfHour,
        bySecondOfMinute,
        byMillisecondOfSecond);
  }

  public Optional<DateTime> endDate() {
    return Optional.ofNullable(end);
  }

  public Optional<Integer> maxCount() {
    return Optional.ofNullable(count);
  }

  /**
   * Returns true if the rule has neither an end nor a count.
   *
   * @return whether the rule is unbounded
   */
  public boolean isInfinite() {
    return end == null && count == null;
  }

  /**
   * Returns true if weekday ordinals are counted within the year rather than the month.
   *
   * @return whether weekday ordinals have year scope
   */
  public boolean hasYearlyWeekdayScope() {
    return frequency == Frequency.YEARLY && byMonthOfYear.isEmpty();
  }

  private static void rejectUnsupported(String name, List<Integer> values) {
    if (!values.isEmpty()) {
      throw CadenceException.config(name + " is not supported");
    }
  }

  private static List<Integer> checkRange(String name, List<Integer> values, int min, int max) {
    for (int value : values) {
      if (value < min || value > max) {
        throw CadenceException.config(
            name + " values must be between " + min + " and " + max + ", got " + value);
      }
    }
    return values.stream().distinct().sorted().toList();
  }

  private static List<Integer> checkDaysOfMonth(Frequency frequency, List<Integer> values) {
    if (values.isEmpty()) {
      return values;
    }
    if (frequency == Frequency.WEEKLY) {
      throw CadenceException.config("byDayOfMonth cannot be used with WEEKLY frequency");
    }
    for (int value : values) {
      if (value == 0 || value < -31 || value > 31) {
        throw CadenceException.config(
            "byDayOfMonth values must be between 1 and 31 or -31 and -1, got " + value);
      }
    }
    return values.stream().distinct().sorted().toList();
  }

  private static List<ByDayOfWeek> checkDaysOfWeek(
      Frequency frequency, boolean hasMonths, Weekday weekStart, List<ByDayOfWeek> values) {
    int maxOrdinal = frequency == Frequency.YEARLY && !hasMonths ? 53 : 5;
    for (ByDayOfWeek day : values) {
      if (!day.hasOrdinal()) {
        continue;
      }
      if (frequency != Frequency.MONTHLY && frequency != Frequency.YEARLY) {
        throw CadenceException.config(
            "byDayOfWeek ordinals are only supported with MONTHLY or YEARLY frequency, got "
                + day);
      }
      if (Math.abs(day.nth()) > maxOrdinal) {
        throw CadenceException.config(
            "byDayOfWeek ordinal must be between -" + maxOrdinal + " and " + maxOrdinal
                + ", got " + day);
      }
    }
    List<Weekday> order = Calendars.orderedWeekdays(weekStart);
    List<ByDayOfWeek> sorted = new ArrayList<>(values.stream().distinct().toList());
    sorted.sort(
        Comparator.comparingInt((ByDayOfWeek d) -> order.indexOf(d.weekday()))
            .thenComparingInt(ByDayOfWeek::nth));
    return List.copyOf(sorted);
  }
}
