package io.cadence.rule.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import io.cadence.CadenceConfig;
import io.cadence.rule.ByDayOfWeek;
import io.cadence.rule.Frequency;
import io.cadence.rule.NormalizedRuleOptions;
import io.cadence.rule.RuleOptions;
import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import io.cadence.time.Weekday;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class DayOfWeekStageTest {

  private static DateTime utc(String iso) {
    return DateTime.parse(iso, "UTC");
  }

  @Test
  void yearlyWeekdayOnMatchingDayIsValid() {
    NormalizedRuleOptions options =
        NormalizedRuleOptions.normalize(
            RuleOptions.of(Frequency.YEARLY, utc("2019-01-01T02:03:04.005"))
                .withByDayOfWeek(List.of(ByDayOfWeek.of(Weekday.TU))),
            CadenceConfig.defaults());
    DayOfWeekStage stage = new DayOfWeekStage(options, false);

    assertEquals(StageResult.valid(), stage.evaluate(utc("2019-01-01T00:00:00")));
  }

  @Test
  void yearlyWeekdayRepairsToNextMatchingDay() {
    NormalizedRuleOptions options =
        NormalizedRuleOptions.normalize(
            RuleOptions.of(Frequency.YEARLY, utc("2019-01-01T02:03:04.005"))
                .withByDayOfWeek(List.of(ByDayOfWeek.of(Weekday.TU))),
            CadenceConfig.defaults());
    DayOfWeekStage stage = new DayOfWeekStage(options, false);

    assertEquals(
        StageResult.repair(utc("2019-01-22T00:00:00")), stage.evaluate(utc("2019-01-16T00:00:00")));
  }

  @Test
  void ordinalWeekdayWithMonthScope() {
    // Third Monday of March 2019 is the 18th
    DayOfWeekStage stage =
        new DayOfWeekStage(List.of(ByDayOfWeek.of(Weekday.MO, 3)), DateUnit.MONTH, false);

    assertEquals(
        StageResult.repair(utc("2019-03-18T00:00:00")), stage.evaluate(utc("2019-03-16T00:00:00")));
    assertEquals(StageResult.valid(), stage.evaluate(utc("2019-03-18T12:00:00")));
    assertEquals(StageResult.reject(DateUnit.MONTH), stage.evaluate(utc("2019-03-19T00:00:00")));
  }

  @Test
  void ordinalWeekdayWithMonthScopeInReverse() {
    DayOfWeekStage stage =
        new DayOfWeekStage(List.of(ByDayOfWeek.of(Weekday.MO, 3)), DateUnit.MONTH, true);

    assertEquals(
        StageResult.repair(utc("2019-03-18T23:59:59.999")),
        stage.evaluate(utc("2019-03-25T10:00:00")));
    assertEquals(StageResult.reject(DateUnit.MONTH), stage.evaluate(utc("2019-03-17T00:00:00")));
  }

  @Test
  void lastWeekdayOfMonth() {
    DayOfWeekStage stage =
        new DayOfWeekStage(List.of(ByDayOfWeek.of(Weekday.FR, -1)), DateUnit.MONTH, false);

    assertEquals(List.of(LocalDate.of(2019, 1, 25)), stage.resolve(LocalDate.of(2019, 1, 10)));
    assertEquals(List.of(LocalDate.of(2019, 3, 29)), stage.resolve(LocalDate.of(2019, 3, 1)));
  }

  @Test
  void ordinalWeekdayWithYearScope() {
    DayOfWeekStage stage =
        new DayOfWeekStage(List.of(ByDayOfWeek.of(Weekday.MO, 20)), DateUnit.YEAR, false);

    assertEquals(List.of(LocalDate.of(2019, 5, 20)), stage.resolve(LocalDate.of(2019, 1, 1)));
    assertEquals(List.of(LocalDate.of(2020, 5, 18)), stage.resolve(LocalDate.of(2020, 12, 31)));
  }

  @Test
  void missingFifthWeekdayIsDropped() {
    // February 2019 has four Fridays
    DayOfWeekStage stage =
        new DayOfWeekStage(List.of(ByDayOfWeek.of(Weekday.FR, 5)), DateUnit.MONTH, false);

    assertTrue(stage.resolve(LocalDate.of(2019, 2, 1)).isEmpty());
    assertEquals(StageResult.reject(DateUnit.MONTH), stage.evaluate(utc("2019-02-01T00:00:00")));
  }

  @Test
  void mixedEveryAndOrdinal() {
    DayOfWeekStage stage =
        new DayOfWeekStage(
            List.of(ByDayOfWeek.of(Weekday.TU, 1), ByDayOfWeek.of(Weekday.SU)),
            DateUnit.MONTH,
            false);

    assertEquals(
        List.of(
            LocalDate.of(2019, 9, 1),
            LocalDate.of(2019, 9, 3),
            LocalDate.of(2019, 9, 8),
            LocalDate.of(2019, 9, 15),
            LocalDate.of(2019, 9, 22),
            LocalDate.of(2019, 9, 29)),
        stage.resolve(LocalDate.of(2019, 9, 14)));
  }

  @Test
  void plainWeekdaysMoveToClosestMatch() {
    DayOfWeekStage stage =
        new DayOfWeekStage(
            List.of(ByDayOfWeek.of(Weekday.MO), ByDayOfWeek.of(Weekday.WE)), null, false);

    // 2019-01-03 is a Thursday
    assertEquals(
        StageResult.repair(utc("2019-01-07T00:00:00")), stage.evaluate(utc("2019-01-03T10:00:00")));
    assertEquals(StageResult.valid(), stage.evaluate(utc("2019-01-02T10:00:00")));
  }

  @Test
  void plainWeekdaysInReverse() {
    DayOfWeekStage stage =
        new DayOfWeekStage(
            List.of(ByDayOfWeek.of(Weekday.MO), ByDayOfWeek.of(Weekday.WE)), null, true);

    assertEquals(
        StageResult.repair(utc("2019-01-02T23:59:59.999")),
        stage.evaluate(utc("2019-01-05T10:00:00")));
  }
}
