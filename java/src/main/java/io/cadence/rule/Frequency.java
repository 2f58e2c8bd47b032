package io.cadence.rule;

import io.cadence.time.DateUnit;
import java.util.Arrays;
import java.util.Optional;

/** The base period of a recurrence rule. */
public enum Frequency {
  YEARLY(DateUnit.YEAR),
  MONTHLY(DateUnit.MONTH),
  WEEKLY(DateUnit.WEEK),
  DAILY(DateUnit.DAY),
  HOURLY(DateUnit.HOUR),
  MINUTELY(DateUnit.MINUTE),
  SECONDLY(DateUnit.SECOND);

  private final DateUnit unit;

  Frequency(DateUnit unit) {
    this.unit = unit;
  }

  /**
   * Returns the calendar unit one period of this frequency spans.
   *
   * @return the unit
   */
  public DateUnit unit() {
    return unit;
  }

  /**
   * Returns true if this frequency is strictly finer than the given one, e.g. HOURLY is finer than
   * DAILY.
   *
   * @param other the frequency to compare against
   * @return whether this frequency has a shorter period
   */
  public boolean isFinerThan(Frequency other) {
    return ordinal() > other.ordinal();
  }

  /**
   * Parses a frequency name (case insensitive).
   *
   * @param s the string to parse
   * @return the frequency if valid
   */
  public static Optional<Frequency> parse(String s) {
    return Arrays.stream(values()).filter(f -> f.name().equalsIgnoreCase(s)).findFirst();
  }
}
