package io.cadence.time;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.stream.Collectors;

/** Reads and writes dates in their JSON form. */
public final class DateTimeCodec {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<DateTimeJson>> LIST_TYPE = new TypeReference<>() {};

  private DateTimeCodec() {}

  /**
   * Serializes a date to JSON.
   *
   * @param date the date
   * @return the JSON text
   * @throws JsonProcessingException if serialization fails
   */
  public static String write(DateTime date) throws JsonProcessingException {
    return MAPPER.writeValueAsString(date.toJson());
  }

  /**
   * Serializes a list of dates to a JSON array.
   *
   * @param dates the dates
   * @return the JSON text
   * @throws JsonProcessingException if serialization fails
   */
  public static String writeAll(List<DateTime> dates) throws JsonProcessingException {
    return MAPPER.writeValueAsString(
        dates.stream().map(DateTime::toJson).collect(Collectors.toList()));
  }

  /**
   * Reads a date from JSON.
   *
   * @param json the JSON text
   * @return the date
   * @throws JsonProcessingException if the text is not a date's JSON form
   * @throws io.cadence.CadenceException if the fields do not name a real date
   */
  public static DateTime read(String json) throws JsonProcessingException {
    return DateTime.fromJson(MAPPER.readValue(json, DateTimeJson.class));
  }

  /**
   * Reads a JSON array of dates.
   *
   * @param json the JSON text
   * @return the dates
   * @throws JsonProcessingException if the text is not an array of dates
   */
  public static List<DateTime> readAll(String json) throws JsonProcessingException {
    return MAPPER.readValue(json, LIST_TYPE).stream()
        .map(DateTime::fromJson)
        .collect(Collectors.toList());
  }
}
