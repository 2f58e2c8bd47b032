package io.cadence.generator;

import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import java.util.List;

/**
 * The occurrences falling within one period.
 *
 * @param dates the occurrences, in order
 * @param granularity the period unit, or null when each collection holds a single occurrence
 * @param periodStart the first millisecond of the period
 * @param periodEnd the last millisecond of the period
 */
public record OccurrenceCollection(
    List<DateTime> dates, DateUnit granularity, DateTime periodStart, DateTime periodEnd) {
  public OccurrenceCollection {
    dates = List.copyOf(dates);
  }
}
