package io.cadence.operator;

import static io.cadence.operator.Operators.*;
import static org.junit.jupiter.api.Assertions.*;

import io.cadence.CadenceException;
import io.cadence.ErrorKind;
import io.cadence.generator.Dates;
import io.cadence.generator.OccurrenceGenerator;
import io.cadence.generator.Rule;
import io.cadence.generator.RunArgs;
import io.cadence.rule.ByDayOfWeek;
import io.cadence.rule.Frequency;
import io.cadence.rule.RuleOptions;
import io.cadence.time.DateTime;
import io.cadence.time.Weekday;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class OperatorsTest {

  private static DateTime utc(String iso) {
    return DateTime.parse(iso, "UTC");
  }

  private static final Dates DATES_A =
      Dates.of(
          utc("2017-09-09T09:09:09.009"),
          utc("2018-11-11T11:11:11.011"),
          utc("2019-01-01T01:01:01.001"),
          utc("2019-01-01T01:01:01.001"),
          utc("2020-03-03T03:03:03.003"));

  private static final Dates DATES_B =
      Dates.of(
          utc("2017-10-10T10:10:10.010"),
          utc("2018-12-12T12:12:12.012"),
          utc("2019-01-01T01:01:01.001"),
          utc("2019-02-02T02:02:02.002"),
          utc("2020-03-03T03:03:03.003"),
          utc("2020-04-04T04:04:04.004"));

  private static List<DateTime> all(OccurrenceGenerator generator) {
    return generator.occurrences().toList();
  }

  private static List<DateTime> reversed(OccurrenceGenerator generator) {
    return generator.occurrences(RunArgs.all().withReverse(true)).toList();
  }

  private static Rule dailyAt(int hour) {
    return Rule.of(
        RuleOptions.of(Frequency.DAILY, DateTime.of(2019, 1, 7, hour, 0, 0, 0, "UTC")));
  }

  // =========================================================================
  // add
  // =========================================================================

  @Test
  void addMergesInOrderKeepingDuplicates() {
    OccurrenceStream stream = OccurrenceStream.of("UTC", add(DATES_A, DATES_B));
    List<DateTime> dates = all(stream);
    assertEquals(11, dates.size());
    assertEquals(
        List.of(
            utc("2017-09-09T09:09:09.009"),
            utc("2017-10-10T10:10:10.010"),
            utc("2018-11-11T11:11:11.011"),
            utc("2018-12-12T12:12:12.012"),
            utc("2019-01-01T01:01:01.001"),
            utc("2019-01-01T01:01:01.001"),
            utc("2019-01-01T01:01:01.001"),
            utc("2019-02-02T02:02:02.002"),
            utc("2020-03-03T03:03:03.003"),
            utc("2020-03-03T03:03:03.003"),
            utc("2020-04-04T04:04:04.004")),
        dates);
  }

  @Test
  void addInReverse() {
    OccurrenceStream stream = OccurrenceStream.of("UTC", add(DATES_A, DATES_B));
    List<DateTime> forward = all(stream);
    List<DateTime> backward = new ArrayList<>(reversed(stream));
    Collections.reverse(backward);
    assertEquals(forward, backward);
  }

  @Test
  void addOfInfiniteRulesIsLazy() {
    OccurrenceStream stream = OccurrenceStream.of("UTC", add(dailyAt(9), dailyAt(17)));
    assertTrue(stream.isInfinite());
    assertEquals(
        List.of(
            utc("2019-01-07T09:00:00"),
            utc("2019-01-07T17:00:00"),
            utc("2019-01-08T09:00:00"),
            utc("2019-01-08T17:00:00")),
        stream.occurrences(RunArgs.all().withTake(4)).toList());
  }

  // =========================================================================
  // subtract
  // =========================================================================

  @Test
  void subtractRemovesEveryCopy() {
    OccurrenceStream stream = OccurrenceStream.of("UTC", add(DATES_A), subtract(DATES_B));
    assertEquals(
        List.of(utc("2017-09-09T09:09:09.009"), utc("2018-11-11T11:11:11.011")), all(stream));
    assertEquals(
        List.of(utc("2018-11-11T11:11:11.011"), utc("2017-09-09T09:09:09.009")), reversed(stream));
  }

  @Test
  void subtractWithoutBaseIsEmpty() {
    assertEquals(List.of(), all(OccurrenceStream.of("UTC", subtract(DATES_B))));
  }

  @Test
  void pipeOrderMatters() {
    OccurrenceStream addAfterSubtract =
        OccurrenceStream.of("UTC", add(DATES_A), subtract(DATES_B), add(DATES_B));
    assertEquals(8, all(addAfterSubtract).size());

    OccurrenceStream subtractAfterAdd =
        OccurrenceStream.of("UTC", add(DATES_A), add(DATES_B), subtract(DATES_B));
    assertEquals(
        List.of(utc("2017-09-09T09:09:09.009"), utc("2018-11-11T11:11:11.011")),
        all(subtractAfterAdd));
  }

  @Test
  void subtractRuleFromRule() {
    Rule mondays =
        Rule.of(
            RuleOptions.of(Frequency.WEEKLY, utc("2019-01-07T09:00:00"))
                .withByDayOfWeek(List.of(ByDayOfWeek.of(Weekday.MO))));
    OccurrenceStream stream = OccurrenceStream.of("UTC", add(dailyAt(9)), subtract(mondays));
    assertEquals(
        List.of(8, 9, 10, 11, 12, 13, 15),
        stream.occurrences(RunArgs.all().withTake(7)).map(DateTime::day).toList());
  }

  // =========================================================================
  // intersection
  // =========================================================================

  @Test
  void intersectionKeepsEveryCopyOfCommonDates() {
    OccurrenceStream stream = OccurrenceStream.of("UTC", intersection(DATES_A, DATES_B));
    assertEquals(
        List.of(
            utc("2019-01-01T01:01:01.001"),
            utc("2019-01-01T01:01:01.001"),
            utc("2019-01-01T01:01:01.001"),
            utc("2020-03-03T03:03:03.003"),
            utc("2020-03-03T03:03:03.003")),
        all(stream));
  }

  @Test
  void intersectionInReverse() {
    OccurrenceStream stream = OccurrenceStream.of("UTC", intersection(DATES_A, DATES_B));
    assertEquals(
        List.of(
            utc("2020-03-03T03:03:03.003"),
            utc("2020-03-03T03:03:03.003"),
            utc("2019-01-01T01:01:01.001"),
            utc("2019-01-01T01:01:01.001"),
            utc("2019-01-01T01:01:01.001")),
        reversed(stream));
  }

  @Test
  void intersectionIncludesBase() {
    OccurrenceStream stream =
        OccurrenceStream.of("UTC", add(DATES_A), intersection(DATES_B), unique());
    assertEquals(
        List.of(utc("2019-01-01T01:01:01.001"), utc("2020-03-03T03:03:03.003")), all(stream));
  }

  @Test
  void intersectionOfAligningRules() {
    Rule everySecondDay =
        Rule.of(RuleOptions.of(Frequency.DAILY, utc("2019-01-01T00:00:00")).withInterval(2));
    Rule everyThirdDay =
        Rule.of(RuleOptions.of(Frequency.DAILY, utc("2019-01-01T00:00:00")).withInterval(3));
    OccurrenceStream stream =
        OccurrenceStream.of("UTC", intersection(everySecondDay, everyThirdDay), unique());
    assertEquals(
        List.of(utc("2019-01-01T00:00:00"), utc("2019-01-07T00:00:00"), utc("2019-01-13T00:00:00")),
        stream.occurrences(RunArgs.all().withTake(3)).toList());
  }

  @Test
  void intersectionOfDisjointRulesFailsToConverge() {
    OccurrenceStream stream = OccurrenceStream.of("UTC", intersection(dailyAt(9), dailyAt(10)));
    CadenceException e = assertThrows(CadenceException.class, stream::firstDate);
    assertEquals(ErrorKind.NON_CONVERGENCE, e.kind());
  }

  // =========================================================================
  // unique
  // =========================================================================

  @Test
  void uniqueCollapsesDuplicates() {
    Dates dates =
        Dates.of(
            utc("2020-03-03T03:03:03.003"),
            utc("2019-01-01T01:01:01.001"),
            utc("2019-01-01T01:01:01.001"));
    assertEquals(
        List.of(utc("2019-01-01T01:01:01.001"), utc("2020-03-03T03:03:03.003")),
        all(OccurrenceStream.of("UTC", add(dates), unique())));
  }

  @Test
  void uniqueOfUnion() {
    OccurrenceStream stream = OccurrenceStream.of("UTC", add(DATES_A, DATES_B), unique());
    List<DateTime> dates = all(stream);
    assertEquals(8, dates.size());
    assertEquals(dates.stream().distinct().toList(), dates);
  }

  @Test
  void uniqueIsIdempotent() {
    OccurrenceStream once = OccurrenceStream.of("UTC", add(DATES_A, DATES_B), unique());
    OccurrenceStream twice = OccurrenceStream.of("UTC", add(once), unique(), unique());
    assertEquals(all(once), all(twice));
  }

  @Test
  void uniqueWithoutBaseIsEmpty() {
    assertEquals(Optional.empty(), OccurrenceStream.of("UTC", unique()).firstDate());
  }

  // =========================================================================
  // Composition
  // =========================================================================

  @Test
  void differencePlusIntersectionRebuildsTheSet() {
    OccurrenceStream difference = OccurrenceStream.of("UTC", add(DATES_A), subtract(DATES_B));
    OccurrenceStream common = OccurrenceStream.of("UTC", intersection(DATES_A, DATES_B));
    OccurrenceStream rebuilt = OccurrenceStream.of("UTC", add(difference, common), unique());

    assertEquals(all(OccurrenceStream.of("UTC", add(DATES_A), unique())), all(rebuilt));
  }

  @Test
  void windowedTraversal() {
    OccurrenceStream stream = OccurrenceStream.of("UTC", add(DATES_A, DATES_B), unique());
    assertEquals(
        List.of(utc("2019-01-01T01:01:01.001"), utc("2019-02-02T02:02:02.002")),
        stream
            .occurrences(
                RunArgs.between(utc("2018-12-12T12:12:12.013"), utc("2019-02-02T02:02:02.002")))
            .toList());
  }

  @Test
  void inputsAreConvertedToStreamTimezone() {
    OccurrenceStream stream =
        OccurrenceStream.of(
            "America/New_York",
            add(Dates.of(utc("2019-01-01T14:00:00"))),
            add(Dates.of(DateTime.parse("2019-01-01T10:00:00", "America/New_York"))));
    assertEquals(
        List.of(
            DateTime.parse("2019-01-01T09:00:00", "America/New_York"),
            DateTime.parse("2019-01-01T10:00:00", "America/New_York")),
        all(stream));
    assertEquals(
        List.of(utc("2019-01-01T14:00:00"), utc("2019-01-01T15:00:00")),
        all(stream.withTimezone("UTC")));
  }

  @Test
  void emptyPipe() {
    OccurrenceStream stream = OccurrenceStream.of("UTC");
    assertEquals(List.of(), all(stream));
    assertFalse(stream.isInfinite());
  }
}
