package io.cadence.time;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The calendar-field JSON form of a {@link DateTime}, exchanged with date backends.
 *
 * <pre>{@code
 * {"timezone":"UTC","year":2019,"month":1,"day":1,"hour":2,"minute":3,"second":4,
 *  "millisecond":5,"duration":3600000}
 * }</pre>
 *
 * @param timezone the timezone label, or null for a floating date
 * @param year the year
 * @param month the month (1-12)
 * @param day the day of month
 * @param hour the hour (0-23)
 * @param minute the minute (0-59)
 * @param second the second (0-59)
 * @param millisecond the millisecond (0-999)
 * @param duration the duration in milliseconds, omitted when there is none
 */
@JsonPropertyOrder({
  "timezone",
  "year",
  "month",
  "day",
  "hour",
  "minute",
  "second",
  "millisecond",
  "duration"
})
public record DateTimeJson(
    String timezone,
    int year,
    int month,
    int day,
    int hour,
    int minute,
    int second,
    int millisecond,
    @JsonInclude(JsonInclude.Include.NON_NULL) Long duration) {}
