package io.cadence.rule.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import java.util.List;
import org.junit.jupiter.api.Test;

class FieldStageTest {

  private static DateTime utc(String iso) {
    return DateTime.parse(iso, "UTC");
  }

  @Test
  void acceptsAllowedValue() {
    FieldStage stage = FieldStage.hour(List.of(9, 17), false);
    assertEquals(StageResult.valid(), stage.evaluate(utc("2019-01-01T17:30:00")));
  }

  @Test
  void repairsToNextValueInParent() {
    FieldStage stage = FieldStage.hour(List.of(9, 17), false);
    assertEquals(
        StageResult.repair(utc("2019-01-01T17:00:00")), stage.evaluate(utc("2019-01-01T10:15:00")));
  }

  @Test
  void wrapsToFirstValueOfNextParent() {
    FieldStage stage = FieldStage.hour(List.of(9, 17), false);
    assertEquals(
        StageResult.repair(utc("2019-01-02T09:00:00")), stage.evaluate(utc("2019-01-01T18:00:00")));
  }

  @Test
  void monthRepairKeepsFirstDayOfMonth() {
    FieldStage stage = FieldStage.month(List.of(2, 11), false);
    assertEquals(
        StageResult.repair(utc("2019-11-01T00:00:00")), stage.evaluate(utc("2019-03-31T12:00:00")));
    assertEquals(
        StageResult.repair(utc("2020-02-01T00:00:00")), stage.evaluate(utc("2019-12-31T12:00:00")));
  }

  @Test
  void reverseRepairsToEndOfPreviousValue() {
    FieldStage stage = FieldStage.month(List.of(3), true);
    assertEquals(
        StageResult.repair(utc("2019-03-31T23:59:59.999")),
        stage.evaluate(utc("2019-04-30T00:00:00")));
    assertEquals(
        StageResult.repair(utc("2018-03-31T23:59:59.999")),
        stage.evaluate(utc("2019-02-10T00:00:00")));
  }

  @Test
  void reverseMinuteWrapsToPreviousHour() {
    FieldStage stage = FieldStage.minute(List.of(30, 45), true);
    assertEquals(
        StageResult.repair(utc("2019-01-01T09:45:59.999")),
        stage.evaluate(utc("2019-01-01T10:10:00")));
  }
}
