package io.cadence.rule.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import java.util.List;
import org.junit.jupiter.api.Test;

class DayOfMonthStageTest {

  private static DateTime utc(String iso) {
    return DateTime.parse(iso, "UTC");
  }

  @Test
  void negativeDaysCountFromMonthEnd() {
    DayOfMonthStage stage = new DayOfMonthStage(List.of(-1, 1), false);
    assertEquals(List.of(1, 31), stage.resolve(2019, 1));
    assertEquals(List.of(1, 28), stage.resolve(2019, 2));
    assertEquals(List.of(1, 29), stage.resolve(2020, 2));
  }

  @Test
  void daysMissingFromMonthAreDropped() {
    DayOfMonthStage stage = new DayOfMonthStage(List.of(30, 31), false);
    assertEquals(List.of(30), stage.resolve(2019, 4));
    assertTrue(stage.resolve(2019, 2).isEmpty());
  }

  @Test
  void repairsWithinMonth() {
    DayOfMonthStage stage = new DayOfMonthStage(List.of(10, 20), false);
    assertEquals(
        StageResult.repair(utc("2019-01-20T00:00:00")), stage.evaluate(utc("2019-01-11T08:00:00")));
  }

  @Test
  void rejectsMonthWithoutRemainingDays() {
    DayOfMonthStage stage = new DayOfMonthStage(List.of(10, 20), false);
    assertEquals(StageResult.reject(DateUnit.MONTH), stage.evaluate(utc("2019-01-21T08:00:00")));
    assertEquals(
        StageResult.reject(DateUnit.MONTH),
        new DayOfMonthStage(List.of(31), false).evaluate(utc("2019-02-01T00:00:00")));
  }

  @Test
  void reverseRepairsToEndOfEarlierDay() {
    DayOfMonthStage stage = new DayOfMonthStage(List.of(10, 20), true);
    assertEquals(
        StageResult.repair(utc("2019-01-10T23:59:59.999")),
        stage.evaluate(utc("2019-01-15T08:00:00")));
    assertEquals(StageResult.reject(DateUnit.MONTH), stage.evaluate(utc("2019-01-09T08:00:00")));
  }
}
