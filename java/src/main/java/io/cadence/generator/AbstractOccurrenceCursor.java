package io.cadence.generator;

import io.cadence.time.DateTime;
import java.util.Optional;

/**
 * Base class for cursors. Applies the traversal's {@code take} limit and hands each pull the
 * pending skip date, if any.
 */
public abstract class AbstractOccurrenceCursor implements OccurrenceCursor {
  protected final RunArgs args;
  protected final boolean reverse;
  private DateTime skipTo;
  private int emitted;
  private boolean done;

  protected AbstractOccurrenceCursor(RunArgs args) {
    this.args = args;
    this.reverse = args.reverse();
  }

  @Override
  public final Optional<DateTime> next() {
    if (done) {
      return Optional.empty();
    }
    if (args.take() != null && emitted >= args.take()) {
      done = true;
      return Optional.empty();
    }
    DateTime pending = skipTo;
    skipTo = null;
    Optional<DateTime> result = advance(pending);
    if (result.isEmpty()) {
      done = true;
    } else {
      emitted++;
    }
    return result;
  }

  @Override
  public final void skipTo(DateTime date) {
    if (skipTo == null || precedes(skipTo, date)) {
      skipTo = date;
    }
  }

  /**
   * Computes the next value.
   *
   * @param skipTo values before this date (after it, in reverse) must not be returned, may be null
   * @return the next value, or empty when exhausted
   */
  protected abstract Optional<DateTime> advance(DateTime skipTo);

  /** Returns true if {@code a} comes before {@code b} in the traversal direction. */
  protected final boolean precedes(DateTime a, DateTime b) {
    return reverse ? a.isAfter(b) : a.isBefore(b);
  }

  /** Returns a cursor that is exhausted from the start. */
  public static OccurrenceCursor empty(RunArgs args) {
    return new AbstractOccurrenceCursor(args) {
      @Override
      protected Optional<DateTime> advance(DateTime skipTo) {
        return Optional.empty();
      }
    };
  }
}
