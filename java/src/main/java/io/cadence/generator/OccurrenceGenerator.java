package io.cadence.generator;

import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A source of occurrences: a recurrence {@link Rule}, an explicit set of {@link Dates}, or an
 * {@link Operator} composing other generators.
 *
 * <p>Generators are immutable. Every traversal opens its own {@link OccurrenceCursor}, so any
 * number of traversals over the same generator may run side by side.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Rule rule = Rule.of(RuleOptions.of(Frequency.WEEKLY, DateTime.of(2019, 1, 7, "UTC")));
 * List<DateTime> firstFour = rule.occurrences(RunArgs.all().withTake(4)).toList();
 * }</pre>
 */
public abstract sealed class OccurrenceGenerator permits Rule, Dates, Operator {

  OccurrenceGenerator() {}

  /**
   * Returns the timezone occurrences are returned in.
   *
   * @return the timezone label, or null for floating dates
   */
  public abstract String timezone();

  /**
   * Returns this generator with occurrences returned in another timezone.
   *
   * @param timezone the timezone label, or null
   * @return the new generator
   */
  public abstract OccurrenceGenerator withTimezone(String timezone);

  /**
   * Returns true if this generator has no last occurrence.
   *
   * @return whether the generator is infinite
   */
  public abstract boolean isInfinite();

  /**
   * Returns true if every occurrence carries a duration.
   *
   * @return whether occurrences have durations
   */
  public abstract boolean hasDuration();

  /**
   * Returns an upper bound on the duration of any occurrence.
   *
   * @return the longest possible duration in milliseconds, or 0 if occurrences have none
   */
  public abstract long longestDuration();

  /**
   * Opens a traversal. The bounds of {@code args} are converted to this generator's timezone first.
   *
   * @param args the traversal bounds
   * @return a new cursor
   */
  public final OccurrenceCursor cursor(RunArgs args) {
    return open(args.withTimezone(timezone()));
  }

  /**
   * Opens a traversal whose bounds are already in this generator's timezone.
   *
   * @param args the traversal bounds
   * @return a new cursor
   */
  protected abstract OccurrenceCursor open(RunArgs args);

  /**
   * Returns a lazy stream of occurrences.
   *
   * @param args the traversal bounds
   * @return a stream of occurrences
   */
  public Stream<DateTime> occurrences(RunArgs args) {
    OccurrenceCursor cursor = cursor(args);
    Iterator<DateTime> iterator =
        new Iterator<>() {
          private DateTime next = null;
          private boolean hasNext = false;
          private boolean computed = false;

          private void computeNext() {
            if (!computed) {
              Optional<DateTime> result = cursor.next();
              next = result.orElse(null);
              hasNext = result.isPresent();
              computed = true;
            }
          }

          @Override
          public boolean hasNext() {
            computeNext();
            return hasNext;
          }

          @Override
          public DateTime next() {
            computeNext();
            if (!hasNext) {
              throw new NoSuchElementException();
            }
            computed = false;
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  public Stream<DateTime> occurrences() {
    return occurrences(RunArgs.all());
  }

  /**
   * Returns a lazy stream of occurrences grouped by period.
   *
   * <p>Without a granularity every occurrence forms its own collection. With one, each collection
   * spans one period; periods without occurrences are included unless {@code skipEmptyPeriods} is
   * set, and run up to {@code end} when it is given.
   *
   * @param args the bounds and grouping
   * @return a stream of collections
   */
  public Stream<OccurrenceCollection> collections(CollectionsArgs args) {
    Iterator<DateTime> dates = occurrences(RunArgs.between(args.start(), args.end())).iterator();
    DateUnit unit = args.granularity();
    DateTime end = args.end() == null ? null : args.end().withTimezone(timezone());
    DateTime start = args.start() == null ? null : args.start().withTimezone(timezone());

    Iterator<OccurrenceCollection> iterator =
        new Iterator<>() {
          private DateTime pending = null;
          private DateTime periodStart = null;
          private OccurrenceCollection next = null;
          private boolean computed = false;
          private int emitted = 0;

          private void computeNext() {
            if (computed) {
              return;
            }
            computed = true;
            next = null;
            if (args.take() != null && emitted >= args.take()) {
              return;
            }
            if (pending == null && dates.hasNext()) {
              pending = dates.next();
            }
            if (unit == null) {
              if (pending != null) {
                next = new OccurrenceCollection(List.of(pending), null, pending, pending);
                pending = null;
              }
              return;
            }
            if (periodStart == null) {
              if (start != null && !args.skipEmptyPeriods()) {
                periodStart = start.granularity(unit, args.weekStart());
              } else if (pending != null) {
                periodStart = pending.granularity(unit, args.weekStart());
              } else {
                return;
              }
            } else if (args.skipEmptyPeriods()) {
              if (pending == null) {
                return;
              }
              periodStart = pending.granularity(unit, args.weekStart());
            }
            if (pending == null && end == null) {
              return;
            }
            if (end != null && periodStart.isAfter(end)) {
              return;
            }
            DateTime periodEnd = periodStart.endGranularity(unit, args.weekStart());
            List<DateTime> group = new ArrayList<>();
            while (pending != null && !pending.isAfter(periodEnd)) {
              group.add(pending);
              pending = dates.hasNext() ? dates.next() : null;
            }
            next = new OccurrenceCollection(group, unit, periodStart, periodEnd);
            periodStart = periodStart.add(1, unit);
          }

          @Override
          public boolean hasNext() {
            computeNext();
            return next != null;
          }

          @Override
          public OccurrenceCollection next() {
            computeNext();
            if (next == null) {
              throw new NoSuchElementException();
            }
            computed = false;
            emitted++;
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Returns true if an occurrence falls on {@code date}. For generators with durations, true if
   * an occurrence's interval contains {@code date}.
   *
   * @param date the date to test
   * @return whether the generator occurs on the date
   */
  public boolean occursOn(DateTime date) {
    DateTime target = date.withTimezone(timezone());
    if (hasDuration()) {
      return occurrences(RunArgs.between(null, target))
          .anyMatch(
              d -> d.timestamp() <= target.timestamp() && d.endTimestamp() >= target.timestamp());
    }
    return occurrences(RunArgs.between(target, target).withTake(1)).findFirst().isPresent();
  }

  /**
   * Returns true if an occurrence falls between two dates. For generators with durations, true if
   * an occurrence's interval overlaps the range.
   *
   * @param start the start of the range
   * @param end the end of the range
   * @param excludeEnds whether occurrences exactly on {@code start} or {@code end} are ignored
   * @return whether the generator occurs in the range
   */
  public boolean occursBetween(DateTime start, DateTime end, boolean excludeEnds) {
    DateTime from = start.withTimezone(timezone());
    DateTime to = end.withTimezone(timezone());
    if (hasDuration()) {
      return occurrences(RunArgs.between(null, to))
          .anyMatch(
              d ->
                  excludeEnds
                      ? d.timestamp() < to.timestamp() && d.endTimestamp() > from.timestamp()
                      : d.timestamp() <= to.timestamp() && d.endTimestamp() >= from.timestamp());
    }
    return occurrences(RunArgs.between(from, to))
        .anyMatch(d -> !excludeEnds || (!d.isEqual(from) && !d.isEqual(to)));
  }

  /**
   * Returns true if an occurrence falls after {@code date}.
   *
   * @param date the date
   * @param excludeStart whether an occurrence exactly on {@code date} is ignored
   * @return whether the generator occurs after the date
   */
  public boolean occursAfter(DateTime date, boolean excludeStart) {
    DateTime from = date.withTimezone(timezone());
    return occurrences(RunArgs.between(from, null).withTake(2))
        .anyMatch(d -> !excludeStart || !d.isEqual(from));
  }

  /**
   * Returns true if an occurrence falls before {@code date}.
   *
   * @param date the date
   * @param excludeStart whether an occurrence exactly on {@code date} is ignored
   * @return whether the generator occurs before the date
   */
  public boolean occursBefore(DateTime date, boolean excludeStart) {
    DateTime to = date.withTimezone(timezone());
    return occurrences(new RunArgs(null, to, 2, true))
        .anyMatch(d -> !excludeStart || !d.isEqual(to));
  }

  /**
   * Returns the first occurrence.
   *
   * @return the first occurrence, or empty if there is none
   */
  public Optional<DateTime> firstDate() {
    return occurrences(RunArgs.all().withTake(1)).findFirst();
  }

  /**
   * Returns the last occurrence.
   *
   * @return the last occurrence, or empty if there is none or the generator is infinite
   */
  public Optional<DateTime> lastDate() {
    if (isInfinite()) {
      return Optional.empty();
    }
    return occurrences(RunArgs.all().withReverse(true).withTake(1)).findFirst();
  }
}
