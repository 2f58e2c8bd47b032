package io.cadence.generator;

import io.cadence.CadenceException;
import io.cadence.time.DateTime;

/**
 * Bounds of a traversal.
 *
 * <p>{@code start} and {@code end} are chronological and inclusive in both directions: a reverse
 * traversal begins at {@code end} and stops at {@code start}.
 *
 * @param start the earliest value to return, or null
 * @param end the latest value to return, or null
 * @param take the maximum number of values to return, or null
 * @param reverse whether values are returned latest first
 */
public record RunArgs(DateTime start, DateTime end, Integer take, boolean reverse) {
  private static final RunArgs ALL = new RunArgs(null, null, null, false);

  public RunArgs {
    if (take != null && take < 0) {
      throw CadenceException.config("take must not be negative, got " + take);
    }
  }

  /**
   * Returns unbounded forward arguments.
   *
   * @return the arguments
   */
  public static RunArgs all() {
    return ALL;
  }

  /**
   * Returns forward arguments between two dates.
   *
   * @param start the earliest value, or null
   * @param end the latest value, or null
   * @return the arguments
   */
  public static RunArgs between(DateTime start, DateTime end) {
    return new RunArgs(start, end, null, false);
  }

  public RunArgs withStart(DateTime start) {
    return new RunArgs(start, end, take, reverse);
  }

  public RunArgs withEnd(DateTime end) {
    return new RunArgs(start, end, take, reverse);
  }

  public RunArgs withTake(Integer take) {
    return new RunArgs(start, end, take, reverse);
  }

  public RunArgs withReverse(boolean reverse) {
    return new RunArgs(start, end, take, reverse);
  }

  /**
   * Returns these arguments with the bounds converted to another timezone.
   *
   * @param timezone the timezone
   * @return the converted arguments
   */
  public RunArgs withTimezone(String timezone) {
    return new RunArgs(
        start == null ? null : start.withTimezone(timezone),
        end == null ? null : end.withTimezone(timezone),
        take,
        reverse);
  }
}
