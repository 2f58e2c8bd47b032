package io.cadence.time;

import java.util.ArrayList;
import java.util.List;

/** Gregorian calendar helpers. */
public final class Calendars {
  private Calendars() {}

  /**
   * Returns true for years divisible by 400, or divisible by 4 and not by 100.
   *
   * @param year the year
   * @return whether the year is a leap year
   */
  public static boolean isLeapYear(int year) {
    return (year % 4 == 0 && year % 100 != 0) || year % 400 == 0;
  }

  /**
   * Returns the number of days in a month.
   *
   * @param year the year
   * @param month the month (1-12)
   * @return the number of days in the month
   */
  public static int monthLength(int year, int month) {
    return switch (month) {
      case 2 -> isLeapYear(year) ? 29 : 28;
      case 4, 6, 9, 11 -> 30;
      case 1, 3, 5, 7, 8, 10, 12 -> 31;
      default -> throw new IllegalArgumentException("invalid month: " + month);
    };
  }

  public static int yearLength(int year) {
    return isLeapYear(year) ? 366 : 365;
  }

  /**
   * Returns the seven weekdays in order, beginning with {@code weekStart}.
   *
   * @param weekStart the first day of the week
   * @return the ordered weekdays
   */
  public static List<Weekday> orderedWeekdays(Weekday weekStart) {
    List<Weekday> result = new ArrayList<>(7);
    for (int i = 0; i < 7; i++) {
      result.add(Weekday.fromNumber(Math.floorMod(weekStart.number() - 1 + i, 7) + 1).get());
    }
    return result;
  }
}
