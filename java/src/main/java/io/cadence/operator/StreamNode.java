package io.cadence.operator;

import io.cadence.generator.OccurrenceCursor;
import io.cadence.generator.OccurrenceGenerator;
import io.cadence.generator.RunArgs;
import io.cadence.time.DateTime;

/** An upstream cursor together with its pending value. */
final class StreamNode {
  private final OccurrenceCursor cursor;
  private final boolean reverse;
  private DateTime value;

  StreamNode(OccurrenceGenerator generator, RunArgs args) {
    this.cursor = generator.cursor(args);
    this.reverse = args.reverse();
    this.value = cursor.next().orElse(null);
  }

  boolean done() {
    return value == null;
  }

  DateTime value() {
    return value;
  }

  /** Replaces the pending value with the next one. */
  void pick() {
    value = cursor.next().orElse(null);
  }

  /**
   * Discards pending values before {@code date} (after it, in reverse). A pending value already at
   * or beyond {@code date} is kept.
   */
  void skipTo(DateTime date) {
    if (value == null || !precedes(value, date)) {
      return;
    }
    cursor.skipTo(date);
    pick();
  }

  boolean precedes(DateTime a, DateTime b) {
    return reverse ? a.isAfter(b) : a.isBefore(b);
  }
}
