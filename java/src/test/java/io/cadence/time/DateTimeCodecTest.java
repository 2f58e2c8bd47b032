package io.cadence.time;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.cadence.CadenceException;
import io.cadence.ErrorKind;
import java.util.List;
import org.junit.jupiter.api.Test;

class DateTimeCodecTest {

  @Test
  void writesCalendarFields() throws JsonProcessingException {
    DateTime date = DateTime.of(2019, 1, 1, 2, 3, 4, 5, "UTC").withDuration(3600000);
    assertEquals(
        "{\"timezone\":\"UTC\",\"year\":2019,\"month\":1,\"day\":1,\"hour\":2,\"minute\":3,"
            + "\"second\":4,\"millisecond\":5,\"duration\":3600000}",
        DateTimeCodec.write(date));
  }

  @Test
  void omitsMissingDuration() throws JsonProcessingException {
    String json = DateTimeCodec.write(DateTime.of(2019, 1, 1, null));
    assertFalse(json.contains("duration"));
    assertTrue(json.contains("\"timezone\":null"));
  }

  @Test
  void readsWhatItWrites() throws JsonProcessingException {
    List<DateTime> dates =
        List.of(
            DateTime.parse("2020-02-29T23:59:59.999", "America/New_York").withDuration(1),
            DateTime.parse("2019-06-01T12:00:00", null));
    assertEquals(dates, DateTimeCodec.readAll(DateTimeCodec.writeAll(dates)));
  }

  @Test
  void impossibleDateIsRejected() {
    String json =
        "{\"timezone\":\"UTC\",\"year\":2019,\"month\":2,\"day\":29,\"hour\":0,\"minute\":0,"
            + "\"second\":0,\"millisecond\":0}";
    CadenceException e = assertThrows(CadenceException.class, () -> DateTimeCodec.read(json));
    assertEquals(ErrorKind.INVALID_DATE, e.kind());
  }

  @Test
  void malformedJsonIsRejected() {
    assertThrows(JsonProcessingException.class, () -> DateTimeCodec.read("{\"year\":"));
  }
}
