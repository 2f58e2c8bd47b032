package io.cadence.time;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.Optional;

/** A day of the week, identified by its two letter recurrence code. */
public enum Weekday {
  SU(7),
  MO(1),
  TU(2),
  WE(3),
  TH(4),
  FR(5),
  SA(6);

  private final int isoNumber;

  Weekday(int isoNumber) {
    this.isoNumber = isoNumber;
  }

  /**
   * Returns the ISO 8601 day number (Monday=1, Sunday=7).
   *
   * @return the ISO day number
   */
  public int number() {
    return isoNumber;
  }

  /**
   * Returns the two letter code, e.g. {@code "MO"}.
   *
   * @return the weekday code
   */
  public String code() {
    return name();
  }

  /**
   * Parses a two letter weekday code (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    String upper = s.trim().toUpperCase();
    return Arrays.stream(values()).filter(w -> w.name().equals(upper)).findFirst();
  }

  /**
   * Returns a Weekday from an ISO 8601 day number.
   *
   * @param n the ISO day number (1-7)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromNumber(int n) {
    if (n < 1 || n > 7) {
      return Optional.empty();
    }
    return Optional.of(fromDayOfWeek(DayOfWeek.of(n)));
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return switch (dow) {
      case MONDAY -> MO;
      case TUESDAY -> TU;
      case WEDNESDAY -> WE;
      case THURSDAY -> TH;
      case FRIDAY -> FR;
      case SATURDAY -> SA;
      case SUNDAY -> SU;
    };
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public DayOfWeek toDayOfWeek() {
    return DayOfWeek.of(isoNumber);
  }

  /**
   * Returns the number of days from this weekday forward to {@code other}, in the range 0-6.
   *
   * @param other the target weekday
   * @return days until {@code other}
   */
  public int daysUntil(Weekday other) {
    return Math.floorMod(other.isoNumber - isoNumber, 7);
  }
}
