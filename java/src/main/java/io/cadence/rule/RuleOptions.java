package io.cadence.rule;

import io.cadence.time.DateTime;
import io.cadence.time.Weekday;
import java.util.List;

/**
 * The options of a recurrence rule as provided, before validation and defaulting.
 *
 * <p>Unset scalar options are null and unset constraint lists are empty. A rule normalizes its
 * options on construction (see {@link NormalizedRuleOptions#normalize}); this record itself does
 * not validate anything beyond copying the lists.
 *
 * <p>{@code byWeekOfYear}, {@code byDayOfYear} and {@code byPosition} are accepted here so that a
 * rule carrying them is rejected on construction rather than silently ignoring them.
 *
 * @param frequency the base period
 * @param start the first candidate and the anchor of interval alignment
 * @param interval the number of periods between occurrences (default 1)
 * @param end the last possible occurrence, inclusive
 * @param count the maximum number of occurrences
 * @param weekStart the first day of the week
 * @param duration the duration in milliseconds given to every occurrence
 * @param byMonthOfYear months (1-12)
 * @param byDayOfMonth days of month (1-31, or -31 to -1 counting from the end)
 * @param byDayOfWeek weekdays, optionally with an ordinal
 * @param byHourOfDay hours (0-23)
 * @param byMinuteOfHour minutes (0-59)
 * @param bySecondOfMinute seconds (0-59)
 * @param byMillisecondOfSecond milliseconds (0-999)
 * @param byWeekOfYear unsupported
 * @param byDayOfYear unsupported
 * @param byPosition unsupported
 */
public record RuleOptions(
    Frequency frequency,
    DateTime start,
    Integer interval,
    DateTime end,
    Integer count,
    Weekday weekStart,
    Long duration,
    List<Integer> byMonthOfYear,
    List<Integer> byDayOfMonth,
    List<ByDayOfWeek> byDayOfWeek,
    List<Integer> byHourOfDay,
    List<Integer> byMinuteOfHour,
    List<Integer> bySecondOfMinute,
    List<Integer> byMillisecondOfSecond,
    List<Integer> byWeekOfYear,
    List<Integer> byDayOfYear,
    List<Integer> byPosition) {
  /** Copies every list; a null list becomes empty. */
  public RuleOptions {
    byMonthOfYear = copy(byMonthOfYear);
    byDayOfMonth = copy(byDayOfMonth);
    byDayOfWeek = byDayOfWeek == null ? List.of() : List.copyOf(byDayOfWeek);
    byHourOfDay = copy(byHourOfDay);
    byMinuteOfHour = copy(byMinuteOfHour);
    bySecondOfMinute = copy(bySecondOfMinute);
    byMillisecondOfSecond = copy(byMillisecondOfSecond);
    byWeekOfYear = copy(byWeekOfYear);
    byDayOfYear = copy(byDayOfYear);
    byPosition = copy(byPosition);
  }

  private static List<Integer> copy(List<Integer> list) {
    return list == null ? List.of() : List.copyOf(list);
  }

  /**
   * Creates options with just a frequency and start; everything else is unset.
   *
   * @param frequency the base period
   * @param start the start date
   * @return a new RuleOptions
   */
  public static RuleOptions of(Frequency frequency, DateTime start) {
    return new RuleOptions(
        frequency, start, null, null, null, null, null, null, null, null, null, null, null, null,
        null, null, null);
  }

  public RuleOptions withFrequency(Frequency frequency) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withStart(DateTime start) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withInterval(Integer interval) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withEnd(DateTime end) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withCount(Integer count) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withWeekStart(Weekday weekStart) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withDuration(Long duration) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withByMonthOfYear(List<Integer> byMonthOfYear) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withByDayOfMonth(List<Integer> byDayOfMonth) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withByDayOfWeek(List<ByDayOfWeek> byDayOfWeek) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withByHourOfDay(List<Integer> byHourOfDay) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withByMinuteOfHour(List<Integer> byMinuteOfHour) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withBySecondOfMinute(List<Integer> bySecondOfMinute) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withByMillisecondOfSecond(List<Integer> byMillisecondOfSecond) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withByWeekOfYear(List<Integer> byWeekOfYear) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withByDayOfYear(List<Integer> byDayOfYear) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }

  public RuleOptions withByPosition(List<Integer> byPosition) {
    return new RuleOptions(
        frequency, start, interval, end, count, weekStart, duration, byMonthOfYear, byDayOfMonth,
        byDayOfWeek, byHourOfDay, byMinuteOfHour, bySecondOfMinute, byMillisecondOfSecond,
        byWeekOfYear, byDayOfYear, byPosition);
  }
}
