package io.cadence.generator;

import io.cadence.time.DateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * An explicit, finite set of dates.
 *
 * <p>Dates are held sorted and converted to the set's timezone. Duplicates are kept; combine with
 * {@link io.cadence.operator.Operators#unique()} to drop them.
 */
public final class Dates extends OccurrenceGenerator {
  private final List<DateTime> dates;
  private final String timezone;

  private Dates(String timezone, List<DateTime> dates) {
    this.timezone = timezone;
    List<DateTime> normalized = new ArrayList<>(dates.size());
    for (DateTime date : dates) {
      normalized.add(Objects.requireNonNull(date, "date").withTimezone(timezone));
    }
    Collections.sort(normalized);
    this.dates = List.copyOf(normalized);
  }

  /**
   * Creates a date set in a timezone.
   *
   * @param timezone the timezone label, or null
   * @param dates the dates, converted to {@code timezone}
   * @return the date set
   */
  public static Dates of(String timezone, List<DateTime> dates) {
    return new Dates(timezone, dates);
  }

  /**
   * Creates a date set in the timezone of its first date.
   *
   * @param dates the dates
   * @return the date set
   */
  public static Dates of(DateTime... dates) {
    return new Dates(dates.length == 0 ? null : dates[0].timezone(), Arrays.asList(dates));
  }

  /**
   * Returns the dates, sorted.
   *
   * @return the dates
   */
  public List<DateTime> dates() {
    return dates;
  }

  public int length() {
    return dates.size();
  }

  /**
   * Returns a new set with a date added.
   *
   * @param date the date to add
   * @return the new set
   */
  public Dates add(DateTime date) {
    List<DateTime> next = new ArrayList<>(dates);
    next.add(date);
    return new Dates(timezone, next);
  }

  /**
   * Returns a new set without any date equal to {@code date}.
   *
   * @param date the date to remove
   * @return the new set
   */
  public Dates remove(DateTime date) {
    DateTime target = date.withTimezone(timezone);
    List<DateTime> next = new ArrayList<>(dates);
    next.removeIf(target::equals);
    return new Dates(timezone, next);
  }

  public Dates withDates(List<DateTime> dates) {
    return new Dates(timezone, dates);
  }

  /**
   * Returns a new set in which every date has the given duration.
   *
   * @param duration the duration in milliseconds, 0 to remove durations
   * @return the new set
   */
  public Dates withDuration(long duration) {
    return new Dates(timezone, dates.stream().map(d -> d.withDuration(duration)).toList());
  }

  @Override
  public Dates withTimezone(String timezone) {
    return withTimezone(timezone, false);
  }

  /**
   * Returns this set in another timezone.
   *
   * @param timezone the timezone label, or null
   * @param keepLocalTime whether to keep the wall-clock fields and only change the label
   * @return the new set
   */
  public Dates withTimezone(String timezone, boolean keepLocalTime) {
    if (Objects.equals(this.timezone, timezone)) {
      return this;
    }
    if (keepLocalTime) {
      return new Dates(timezone, dates.stream().map(d -> d.withTimezoneLabel(timezone)).toList());
    }
    return new Dates(timezone, dates);
  }

  /**
   * Returns a new set with only the dates matching a predicate.
   *
   * @param predicate the predicate
   * @return the new set
   */
  public Dates filter(Predicate<DateTime> predicate) {
    return new Dates(timezone, dates.stream().filter(predicate).toList());
  }

  @Override
  public String timezone() {
    return timezone;
  }

  @Override
  public boolean isInfinite() {
    return false;
  }

  @Override
  public boolean hasDuration() {
    return !dates.isEmpty() && dates.stream().allMatch(DateTime::hasDuration);
  }

  @Override
  public long longestDuration() {
    return dates.stream().mapToLong(DateTime::duration).max().orElse(0);
  }

  @Override
  protected OccurrenceCursor open(RunArgs args) {
    List<DateTime> selected = new ArrayList<>();
    for (DateTime date : dates) {
      if (args.start() != null && date.isBefore(args.start())) {
        continue;
      }
      if (args.end() != null && date.isAfter(args.end())) {
        continue;
      }
      selected.add(date);
    }
    if (args.reverse()) {
      Collections.reverse(selected);
    }
    return new AbstractOccurrenceCursor(args) {
      private int index = 0;

      @Override
      protected Optional<DateTime> advance(DateTime skipTo) {
        if (skipTo != null) {
          while (index < selected.size() && precedes(selected.get(index), skipTo)) {
            index++;
          }
        }
        if (index >= selected.size()) {
          return Optional.empty();
        }
        return Optional.of(selected.get(index++));
      }
    };
  }
}
