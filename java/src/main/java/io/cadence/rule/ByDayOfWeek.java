package io.cadence.rule;

import io.cadence.time.Weekday;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A day-of-week constraint, optionally restricted to the nth such weekday of the enclosing month or
 * year ({@code 3MO} is the third Monday, {@code -1FR} the last Friday).
 *
 * @param weekday the weekday
 * @param nth the ordinal, or 0 for every such weekday
 */
public record ByDayOfWeek(Weekday weekday, int nth) {
  private static final Pattern FORMAT = Pattern.compile("([+-]?\\d{1,2})?([A-Za-z]{2})");

  public ByDayOfWeek {
    if (weekday == null) {
      throw new IllegalArgumentException("weekday is required");
    }
  }

  /**
   * Matches every occurrence of a weekday.
   *
   * @param weekday the weekday
   * @return the constraint
   */
  public static ByDayOfWeek of(Weekday weekday) {
    return new ByDayOfWeek(weekday, 0);
  }

  /**
   * Matches only the nth occurrence of a weekday. Negative ordinals count from the end.
   *
   * @param weekday the weekday
   * @param nth the ordinal
   * @return the constraint
   */
  public static ByDayOfWeek of(Weekday weekday, int nth) {
    return new ByDayOfWeek(weekday, nth);
  }

  public boolean hasOrdinal() {
    return nth != 0;
  }

  /**
   * Parses the textual form, e.g. {@code MO}, {@code 3MO} or {@code -1FR}.
   *
   * @param s the string to parse
   * @return the constraint if valid
   */
  public static Optional<ByDayOfWeek> parse(String s) {
    Matcher m = FORMAT.matcher(s.trim());
    if (!m.matches()) {
      return Optional.empty();
    }
    int nth = m.group(1) == null ? 0 : Integer.parseInt(m.group(1));
    return Weekday.parse(m.group(2)).map(w -> new ByDayOfWeek(w, nth));
  }

  @Override
  public String toString() {
    return nth == 0 ? weekday.code() : nth + weekday.code();
  }
}
