package io.cadence.time;

import io.cadence.CadenceException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable point in time carrying a timezone label and an optional duration.
 *
 * <p>Calendar fields are held as floating wall-clock values: the timestamp is the number of
 * milliseconds since the epoch at which those wall-clock fields would be read in UTC. This keeps
 * every calendar computation free of offset transitions; {@link #withTimezone(String)} is the only
 * operation that consults zone rules.
 *
 * <p>Dates may only be compared when their timezone labels match exactly. Comparing a {@code UTC}
 * date with an {@code America/New_York} date, or with a floating ({@code null}) one, throws a
 * {@link io.cadence.ErrorKind#COMPARISON} error.
 *
 * <p>Ordering (via {@link #compareTo(DateTime)}) is by timestamp, then by duration. Equality
 * ({@link #isEqual(DateTime)}) is by timestamp alone.
 */
public final class DateTime implements Comparable<DateTime> {
  private static final DateTimeFormatter ISO_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS");

  private final long timestamp;
  private final String timezone;
  private final long duration;
  private final LocalDateTime fields;

  private DateTime(long timestamp, String timezone, long duration) {
    if (duration < 0) {
      throw CadenceException.config("duration must be a non-negative number of milliseconds");
    }
    this.timestamp = timestamp;
    this.timezone = timezone;
    this.duration = duration;
    this.fields =
        LocalDateTime.ofEpochSecond(
            Math.floorDiv(timestamp, 1000L),
            (int) Math.floorMod(timestamp, 1000L) * 1_000_000,
            ZoneOffset.UTC);
  }

  /**
   * Creates a date from calendar fields.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month (1-31)
   * @param hour the hour (0-23)
   * @param minute the minute (0-59)
   * @param second the second (0-59)
   * @param millisecond the millisecond (0-999)
   * @param timezone the timezone label, or null for a floating date
   * @return the date
   * @throws CadenceException if the fields do not name a real date
   */
  public static DateTime of(
      int year,
      int month,
      int day,
      int hour,
      int minute,
      int second,
      int millisecond,
      String timezone) {
    if (millisecond < 0 || millisecond > 999) {
      throw CadenceException.invalidDate("invalid millisecond: " + millisecond);
    }
    try {
      return of(
          LocalDateTime.of(year, month, day, hour, minute, second, millisecond * 1_000_000),
          timezone);
    } catch (DateTimeException e) {
      throw CadenceException.invalidDate(e.getMessage());
    }
  }

  /**
   * Creates a date at midnight.
   *
   * @param year the year
   * @param month the month (1-12)
   * @param day the day of month
   * @param timezone the timezone label, or null for a floating date
   * @return the date
   */
  public static DateTime of(int year, int month, int day, String timezone) {
    return of(year, month, day, 0, 0, 0, 0, timezone);
  }

  /**
   * Creates a date from wall-clock fields. Sub-millisecond precision is dropped.
   *
   * @param local the wall-clock fields
   * @param timezone the timezone label, or null for a floating date
   * @return the date
   */
  public static DateTime of(LocalDateTime local, String timezone) {
    return new DateTime(local.toInstant(ZoneOffset.UTC).toEpochMilli(), timezone, 0);
  }

  /**
   * Parses an ISO local date-time such as {@code 2019-01-01T02:03:04.005}.
   *
   * @param iso the wall-clock text
   * @param timezone the timezone label, or null for a floating date
   * @return the date
   * @throws CadenceException if the text is not a valid date-time
   */
  public static DateTime parse(String iso, String timezone) {
    try {
      return of(LocalDateTime.parse(iso), timezone);
    } catch (DateTimeParseException e) {
      throw CadenceException.invalidDate(e.getMessage());
    }
  }

  /**
   * Creates a date from its floating timestamp.
   *
   * @param timestamp the wall-clock fields, read as milliseconds since the epoch in UTC
   * @param timezone the timezone label, or null for a floating date
   * @return the date
   */
  public static DateTime ofEpochMillis(long timestamp, String timezone) {
    return new DateTime(timestamp, timezone, 0);
  }

  /**
   * Creates a date from its JSON form.
   *
   * @param json the JSON form
   * @return the date
   * @throws CadenceException if the fields do not name a real date or the duration is negative
   */
  public static DateTime fromJson(DateTimeJson json) {
    DateTime date =
        of(
            json.year(),
            json.month(),
            json.day(),
            json.hour(),
            json.minute(),
            json.second(),
            json.millisecond(),
            json.timezone());
    return json.duration() == null ? date : date.withDuration(json.duration());
  }

  /**
   * Returns the JSON form of this date. The duration is omitted when it is zero.
   *
   * @return the JSON form
   */
  public DateTimeJson toJson() {
    return new DateTimeJson(
        timezone,
        year(),
        month(),
        day(),
        hour(),
        minute(),
        second(),
        millisecond(),
        duration == 0 ? null : duration);
  }

  // Accessors

  public long timestamp() {
    return timestamp;
  }

  public String timezone() {
    return timezone;
  }

  public long duration() {
    return duration;
  }

  public boolean hasDuration() {
    return duration > 0;
  }

  public int year() {
    return fields.getYear();
  }

  public int month() {
    return fields.getMonthValue();
  }

  public int day() {
    return fields.getDayOfMonth();
  }

  public int hour() {
    return fields.getHour();
  }

  public int minute() {
    return fields.getMinute();
  }

  public int second() {
    return fields.getSecond();
  }

  public int millisecond() {
    return fields.getNano() / 1_000_000;
  }

  public Weekday weekday() {
    return Weekday.fromDayOfWeek(fields.getDayOfWeek());
  }

  /**
   * Returns the day of the year (1-366).
   *
   * @return the day of the year
   */
  public int yearDay() {
    return fields.getDayOfYear();
  }

  /**
   * Returns the wall-clock fields of this date.
   *
   * @return the wall-clock fields
   */
  public LocalDateTime toLocalDateTime() {
    return fields;
  }

  /**
   * Returns a calendar field by unit.
   *
   * @param unit the unit, any but {@link DateUnit#WEEK}
   * @return the field value
   */
  public int get(DateUnit unit) {
    return switch (unit) {
      case YEAR -> year();
      case MONTH -> month();
      case DAY -> day();
      case HOUR -> hour();
      case MINUTE -> minute();
      case SECOND -> second();
      case MILLISECOND -> millisecond();
      case WEEK -> throw new IllegalArgumentException("week is not a calendar field");
    };
  }

  /**
   * Returns the end of this date's interval.
   *
   * @return the end, or empty when the date has no duration
   */
  public Optional<DateTime> end() {
    if (duration == 0) {
      return Optional.empty();
    }
    return Optional.of(new DateTime(timestamp + duration, timezone, 0));
  }

  /**
   * Returns the timestamp at which this date's interval ends, which is the start timestamp when the
   * date has no duration.
   *
   * @return the end timestamp
   */
  public long endTimestamp() {
    return timestamp + duration;
  }

  // Arithmetic

  /**
   * Adds an amount of a unit. Adding months or years clamps the day to the target month's length.
   *
   * @param amount the amount, may be negative
   * @param unit the unit
   * @return the new date
   */
  public DateTime add(long amount, DateUnit unit) {
    return switch (unit) {
      case YEAR -> withFields(fields.plusYears(amount));
      case MONTH -> withFields(fields.plusMonths(amount));
      default -> new DateTime(
          Math.addExact(timestamp, Math.multiplyExact(amount, unit.millis())), timezone, duration);
    };
  }

  public DateTime subtract(long amount, DateUnit unit) {
    return add(-amount, unit);
  }

  /**
   * Sets a calendar field. Setting the year or month clamps the day to the new month's length.
   *
   * @param unit the field, any but {@link DateUnit#WEEK}
   * @param value the new value
   * @return the new date
   * @throws CadenceException if the result would not be a real date, e.g. day 30 of February
   */
  public DateTime set(DateUnit unit, int value) {
    try {
      return switch (unit) {
        case YEAR -> withFields(fields.withYear(value));
        case MONTH -> withFields(fields.withMonth(value));
        case DAY -> withFields(fields.withDayOfMonth(value));
        case HOUR -> withFields(fields.withHour(value));
        case MINUTE -> withFields(fields.withMinute(value));
        case SECOND -> withFields(fields.withSecond(value));
        case MILLISECOND -> {
          if (value < 0 || value > 999) {
            throw CadenceException.invalidDate("invalid millisecond: " + value);
          }
          yield withFields(fields.withNano(value * 1_000_000));
        }
        case WEEK -> throw new IllegalArgumentException("week is not a calendar field");
      };
    } catch (DateTimeException e) {
      throw CadenceException.invalidDate(e.getMessage());
    }
  }

  /**
   * Returns a copy of this date with the given duration.
   *
   * @param duration the duration in milliseconds
   * @return the new date
   * @throws CadenceException if the duration is negative
   */
  public DateTime withDuration(long duration) {
    return new DateTime(timestamp, timezone, duration);
  }

  /**
   * Truncates this date to the start of the enclosing unit.
   *
   * @param unit the unit
   * @param weekStart the first day of the week, used when truncating to a week
   * @return the truncated date
   */
  public DateTime granularity(DateUnit unit, Weekday weekStart) {
    LocalDateTime start =
        switch (unit) {
          case YEAR -> fields.toLocalDate().withDayOfYear(1).atStartOfDay();
          case MONTH -> fields.toLocalDate().withDayOfMonth(1).atStartOfDay();
          case WEEK -> fields
              .toLocalDate()
              .minusDays(weekStart.daysUntil(weekday()))
              .atStartOfDay();
          case DAY -> fields.toLocalDate().atStartOfDay();
          case HOUR -> fields.withMinute(0).withSecond(0).withNano(0);
          case MINUTE -> fields.withSecond(0).withNano(0);
          case SECOND -> fields.withNano(0);
          case MILLISECOND -> fields;
        };
    return withFields(start);
  }

  public DateTime granularity(DateUnit unit) {
    return granularity(unit, Weekday.MO);
  }

  /**
   * Moves this date to the last millisecond of the enclosing unit.
   *
   * @param unit the unit
   * @param weekStart the first day of the week, used for weeks
   * @return the date at the end of the unit
   */
  public DateTime endGranularity(DateUnit unit, Weekday weekStart) {
    return granularity(unit, weekStart).add(1, unit).subtract(1, DateUnit.MILLISECOND);
  }

  public DateTime endGranularity(DateUnit unit) {
    return endGranularity(unit, Weekday.MO);
  }

  private DateTime withFields(LocalDateTime local) {
    return new DateTime(local.toInstant(ZoneOffset.UTC).toEpochMilli(), timezone, duration);
  }

  // Timezones

  /**
   * Returns this date in another timezone.
   *
   * <p>Between two named zones the instant is preserved and the wall-clock fields change. When
   * either side is floating ({@code null}) the wall-clock fields are kept and only the label
   * changes.
   *
   * @param zone the target timezone label, or null
   * @return the date in the target timezone
   * @throws CadenceException if a zone label is not a known zone id
   */
  public DateTime withTimezone(String zone) {
    if (Objects.equals(timezone, zone)) {
      return this;
    }
    if (timezone == null || zone == null) {
      return new DateTime(timestamp, zone, duration);
    }
    Instant instant = fields.atZone(zoneId(timezone)).toInstant();
    LocalDateTime local = LocalDateTime.ofInstant(instant, zoneId(zone));
    return new DateTime(local.toInstant(ZoneOffset.UTC).toEpochMilli(), zone, duration);
  }

  /**
   * Returns this date with another timezone label and the same wall-clock fields.
   *
   * @param zone the new timezone label, or null
   * @return the relabelled date
   */
  public DateTime withTimezoneLabel(String zone) {
    return Objects.equals(timezone, zone) ? this : new DateTime(timestamp, zone, duration);
  }

  private static ZoneId zoneId(String zone) {
    try {
      return ZoneId.of(zone);
    } catch (DateTimeException e) {
      throw CadenceException.config("unknown timezone: " + zone);
    }
  }

  // Comparison

  private void assertSameTimezone(DateTime other) {
    if (!Objects.equals(timezone, other.timezone)) {
      throw CadenceException.comparison(timezone, other.timezone);
    }
  }

  public boolean isEqual(DateTime other) {
    assertSameTimezone(other);
    return timestamp == other.timestamp;
  }

  public boolean isBefore(DateTime other) {
    assertSameTimezone(other);
    return timestamp < other.timestamp;
  }

  public boolean isBeforeOrEqual(DateTime other) {
    assertSameTimezone(other);
    return timestamp <= other.timestamp;
  }

  public boolean isAfter(DateTime other) {
    assertSameTimezone(other);
    return timestamp > other.timestamp;
  }

  public boolean isAfterOrEqual(DateTime other) {
    assertSameTimezone(other);
    return timestamp >= other.timestamp;
  }

  /**
   * Returns true if {@code date} falls within this date's interval, ends included.
   *
   * @param date the date to test
   * @return whether the date falls within this interval
   * @throws CadenceException if this date has no duration
   */
  public boolean isOccurring(DateTime date) {
    if (duration == 0) {
      throw CadenceException.config("isOccurring() requires a date with a duration");
    }
    assertSameTimezone(date);
    return date.timestamp >= timestamp && date.timestamp <= timestamp + duration;
  }

  /**
   * Orders by timestamp, then by duration. A date without a duration sorts before any date with one
   * at the same timestamp.
   *
   * @throws CadenceException if the timezone labels differ
   */
  @Override
  public int compareTo(DateTime other) {
    assertSameTimezone(other);
    int byTimestamp = Long.compare(timestamp, other.timestamp);
    if (byTimestamp != 0) {
      return byTimestamp;
    }
    return Long.compare(duration, other.duration);
  }

  /**
   * Returns the wall-clock fields in ISO form, e.g. {@code 2019-01-01T02:03:04.005}.
   *
   * @return the ISO text
   */
  public String toIsoString() {
    return fields.format(ISO_FORMAT);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DateTime)) {
      return false;
    }
    DateTime other = (DateTime) o;
    return timestamp == other.timestamp
        && duration == other.duration
        && Objects.equals(timezone, other.timezone);
  }

  @Override
  public int hashCode() {
    return Objects.hash(timestamp, timezone, duration);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(toIsoString());
    if (timezone != null) {
      sb.append('[').append(timezone).append(']');
    }
    if (duration > 0) {
      sb.append(" +").append(duration).append("ms");
    }
    return sb.toString();
  }
}
