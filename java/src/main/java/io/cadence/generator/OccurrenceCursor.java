package io.cadence.generator;

import io.cadence.time.DateTime;
import java.util.Optional;

/**
 * A single traversal over an {@link OccurrenceGenerator}.
 *
 * <p>Values are pulled one at a time with {@link #next()}, in ascending order, or descending order
 * for a reverse traversal. Between pulls the consumer may call {@link #skipTo(DateTime)} to tell
 * the cursor that values before a date (after it, in reverse) are of no interest; the next pull
 * then returns the first value at or beyond that date. Skipping is a hint: it never changes the
 * order of returned values, and a cursor may honour it by simply discarding values.
 *
 * <p>Cursors are not thread-safe. A traversal is abandoned by no longer pulling from it.
 */
public interface OccurrenceCursor {
  /**
   * Returns the next value.
   *
   * @return the next value, or empty once the traversal is exhausted
   * @throws io.cadence.CadenceException if the traversal cannot converge on its next value
   */
  Optional<DateTime> next();

  /**
   * Asks the cursor to discard values before {@code date} (after it, in reverse) on the next pull.
   *
   * @param date the date to skip to
   */
  void skipTo(DateTime date);
}
