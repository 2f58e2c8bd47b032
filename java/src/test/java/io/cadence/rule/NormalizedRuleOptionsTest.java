package io.cadence.rule;

import static org.junit.jupiter.api.Assertions.*;

import io.cadence.CadenceConfig;
import io.cadence.CadenceException;
import io.cadence.ErrorKind;
import io.cadence.time.DateTime;
import io.cadence.time.Weekday;
import java.util.List;
import org.junit.jupiter.api.Test;

class NormalizedRuleOptionsTest {
  private static final DateTime START = DateTime.parse("2019-01-01T02:03:04.005", "UTC");

  private static NormalizedRuleOptions normalize(RuleOptions options) {
    return NormalizedRuleOptions.normalize(options, CadenceConfig.defaults());
  }

  private static void assertConfigError(RuleOptions options) {
    CadenceException e = assertThrows(CadenceException.class, () -> normalize(options));
    assertEquals(ErrorKind.CONFIG, e.kind());
  }

  // =========================================================================
  // Defaults
  // =========================================================================

  @Test
  void dailyDefaultsTimeOfDayFromStart() {
    NormalizedRuleOptions options = normalize(RuleOptions.of(Frequency.DAILY, START));
    assertEquals(1, options.interval());
    assertEquals(Weekday.MO, options.weekStart());
    assertEquals(0, options.duration());
    assertEquals(List.of(2), options.byHourOfDay());
    assertEquals(List.of(3), options.byMinuteOfHour());
    assertEquals(List.of(4), options.bySecondOfMinute());
    assertEquals(List.of(5), options.byMillisecondOfSecond());
    assertTrue(options.byMonthOfYear().isEmpty());
    assertTrue(options.byDayOfMonth().isEmpty());
    assertTrue(options.byDayOfWeek().isEmpty());
    assertTrue(options.isInfinite());
  }

  @Test
  void minutelyLeavesCoarserUnitsFree() {
    NormalizedRuleOptions options = normalize(RuleOptions.of(Frequency.MINUTELY, START));
    assertTrue(options.byHourOfDay().isEmpty());
    assertTrue(options.byMinuteOfHour().isEmpty());
    assertEquals(List.of(4), options.bySecondOfMinute());
    assertEquals(List.of(5), options.byMillisecondOfSecond());
  }

  @Test
  void weeklyDefaultsToStartWeekday() {
    NormalizedRuleOptions options = normalize(RuleOptions.of(Frequency.WEEKLY, START));
    assertEquals(List.of(ByDayOfWeek.of(Weekday.TU)), options.byDayOfWeek());
  }

  @Test
  void monthlyDefaultsToStartDay() {
    NormalizedRuleOptions options = normalize(RuleOptions.of(Frequency.MONTHLY, START));
    assertEquals(List.of(1), options.byDayOfMonth());
    assertTrue(options.byMonthOfYear().isEmpty());
  }

  @Test
  void yearlyDefaultsToStartMonthAndDay() {
    NormalizedRuleOptions options = normalize(RuleOptions.of(Frequency.YEARLY, START));
    assertEquals(List.of(1), options.byMonthOfYear());
    assertEquals(List.of(1), options.byDayOfMonth());
  }

  @Test
  void yearlyWithWeekdaysHasNoDefaultMonth() {
    NormalizedRuleOptions options =
        normalize(
            RuleOptions.of(Frequency.YEARLY, START)
                .withByDayOfWeek(List.of(ByDayOfWeek.of(Weekday.MO, 20))));
    assertTrue(options.byMonthOfYear().isEmpty());
    assertTrue(options.byDayOfMonth().isEmpty());
    assertTrue(options.hasYearlyWeekdayScope());
  }

  @Test
  void listsAreSortedAndDeduplicated() {
    NormalizedRuleOptions options =
        normalize(
            RuleOptions.of(Frequency.DAILY, START)
                .withByHourOfDay(List.of(17, 9, 17))
                .withByDayOfWeek(
                    List.of(
                        ByDayOfWeek.of(Weekday.SU),
                        ByDayOfWeek.of(Weekday.MO),
                        ByDayOfWeek.of(Weekday.SU))));
    assertEquals(List.of(9, 17), options.byHourOfDay());
    assertEquals(
        List.of(ByDayOfWeek.of(Weekday.MO), ByDayOfWeek.of(Weekday.SU)), options.byDayOfWeek());
  }

  @Test
  void weekdaysFollowWeekStart() {
    NormalizedRuleOptions options =
        normalize(
            RuleOptions.of(Frequency.DAILY, START)
                .withWeekStart(Weekday.SU)
                .withByDayOfWeek(List.of(ByDayOfWeek.of(Weekday.MO), ByDayOfWeek.of(Weekday.SU))));
    assertEquals(
        List.of(ByDayOfWeek.of(Weekday.SU), ByDayOfWeek.of(Weekday.MO)), options.byDayOfWeek());
  }

  @Test
  void configSuppliesDefaultWeekStart() {
    NormalizedRuleOptions options =
        NormalizedRuleOptions.normalize(
            RuleOptions.of(Frequency.WEEKLY, START),
            CadenceConfig.defaults().withDefaultWeekStart(Weekday.SU));
    assertEquals(Weekday.SU, options.weekStart());
  }

  // =========================================================================
  // Validation
  // =========================================================================

  @Test
  void requiresFrequencyAndStart() {
    assertConfigError(RuleOptions.of(null, START));
    assertConfigError(RuleOptions.of(Frequency.DAILY, null));
  }

  @Test
  void rejectsNonPositiveIntervalAndCount() {
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withInterval(0));
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withCount(0));
  }

  @Test
  void rejectsEndWithCount() {
    assertConfigError(
        RuleOptions.of(Frequency.DAILY, START)
            .withCount(3)
            .withEnd(DateTime.parse("2019-02-01T00:00:00", "UTC")));
  }

  @Test
  void rejectsEndInAnotherTimezone() {
    assertConfigError(
        RuleOptions.of(Frequency.DAILY, START)
            .withEnd(DateTime.parse("2019-02-01T00:00:00", "America/New_York")));
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withByMonthOfYear(List.of(13)));
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withByHourOfDay(List.of(24)));
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withByMinuteOfHour(List.of(-1)));
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withByDayOfMonth(List.of(0)));
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withByDayOfMonth(List.of(32)));
    assertConfigError(
        RuleOptions.of(Frequency.DAILY, START).withByMillisecondOfSecond(List.of(1000)));
  }

  @Test
  void rejectsDayOfMonthForWeekly() {
    assertConfigError(RuleOptions.of(Frequency.WEEKLY, START).withByDayOfMonth(List.of(1)));
  }

  @Test
  void rejectsWeekdayOrdinalsOutsideMonthlyAndYearly() {
    assertConfigError(
        RuleOptions.of(Frequency.WEEKLY, START)
            .withByDayOfWeek(List.of(ByDayOfWeek.of(Weekday.MO, 1))));
    assertConfigError(
        RuleOptions.of(Frequency.MONTHLY, START)
            .withByDayOfWeek(List.of(ByDayOfWeek.of(Weekday.MO, 6))));
    assertDoesNotThrow(
        () ->
            normalize(
                RuleOptions.of(Frequency.YEARLY, START)
                    .withByDayOfWeek(List.of(ByDayOfWeek.of(Weekday.MO, -53)))));
  }

  @Test
  void rejectsUnsupportedConstraints() {
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withByWeekOfYear(List.of(1)));
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withByDayOfYear(List.of(1)));
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withByPosition(List.of(1)));
  }

  @Test
  void rejectsNegativeDuration() {
    assertConfigError(RuleOptions.of(Frequency.DAILY, START).withDuration(-1L));
  }

  // =========================================================================
  // Parsing
  // =========================================================================

  @Test
  void parsesWeekdayCodes() {
    assertEquals(ByDayOfWeek.of(Weekday.MO, 3), ByDayOfWeek.parse("3MO").orElseThrow());
    assertEquals(ByDayOfWeek.of(Weekday.FR, -1), ByDayOfWeek.parse("-1FR").orElseThrow());
    assertEquals(ByDayOfWeek.of(Weekday.SU), ByDayOfWeek.parse("SU").orElseThrow());
    assertTrue(ByDayOfWeek.parse("XX").isEmpty());
    assertTrue(ByDayOfWeek.parse("99999999999MO").isEmpty());
    assertTrue(ByDayOfWeek.parse("123MO").isEmpty());
    assertEquals(Frequency.MONTHLY, Frequency.parse("monthly").orElseThrow());
    assertTrue(Frequency.parse("fortnightly").isEmpty());
  }
}
