package io.cadence.rule.pipeline;

import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import java.util.List;

/**
 * Restricts a single calendar field (month, hour, minute, second or millisecond) to a set of
 * values.
 *
 * <p>A failing candidate is repaired to the start of the next allowed value within the enclosing
 * {@code parent} window, or to the first allowed value of the next parent window when none is left.
 * In reverse the repair lands on the last millisecond of the previous allowed value.
 */
public final class FieldStage implements ConstraintStage {
  private final DateUnit field;
  private final DateUnit parent;
  private final List<Integer> values;
  private final boolean reverse;

  /**
   * Creates a stage for one field.
   *
   * @param field the constrained field
   * @param parent the unit enclosing the field, e.g. {@link DateUnit#YEAR} for months
   * @param values the allowed values, sorted ascending and non-empty
   * @param reverse whether the traversal runs backwards
   */
  public FieldStage(DateUnit field, DateUnit parent, List<Integer> values, boolean reverse) {
    if (values.isEmpty()) {
      throw new IllegalArgumentException("a field stage needs at least one value");
    }
    this.field = field;
    this.parent = parent;
    this.values = List.copyOf(values);
    this.reverse = reverse;
  }

  public static FieldStage month(List<Integer> values, boolean reverse) {
    return new FieldStage(DateUnit.MONTH, DateUnit.YEAR, values, reverse);
  }

  public static FieldStage hour(List<Integer> values, boolean reverse) {
    return new FieldStage(DateUnit.HOUR, DateUnit.DAY, values, reverse);
  }

  public static FieldStage minute(List<Integer> values, boolean reverse) {
    return new FieldStage(DateUnit.MINUTE, DateUnit.HOUR, values, reverse);
  }

  public static FieldStage second(List<Integer> values, boolean reverse) {
    return new FieldStage(DateUnit.SECOND, DateUnit.MINUTE, values, reverse);
  }

  public static FieldStage millisecond(List<Integer> values, boolean reverse) {
    return new FieldStage(DateUnit.MILLISECOND, DateUnit.SECOND, values, reverse);
  }

  @Override
  public StageResult evaluate(DateTime candidate) {
    int current = candidate.get(field);
    if (values.contains(current)) {
      return StageResult.valid();
    }
    return reverse ? previous(candidate, current) : next(candidate, current);
  }

  private StageResult next(DateTime candidate, int current) {
    for (int value : values) {
      if (value > current) {
        return StageResult.repair(candidate.granularity(field).set(field, value));
      }
    }
    DateTime nextParent = candidate.granularity(parent).add(1, parent);
    return StageResult.repair(nextParent.set(field, values.get(0)));
  }

  private StageResult previous(DateTime candidate, int current) {
    for (int i = values.size() - 1; i >= 0; i--) {
      int value = values.get(i);
      if (value < current) {
        return StageResult.repair(endOf(candidate, value));
      }
    }
    DateTime previousParentEnd =
        candidate.granularity(parent).subtract(1, DateUnit.MILLISECOND);
    return StageResult.repair(endOf(previousParentEnd, values.get(values.size() - 1)));
  }

  // Truncating before setting keeps a month repair from clamping to a shorter month's day.
  private DateTime endOf(DateTime date, int value) {
    return date.granularity(field).set(field, value).endGranularity(field);
  }
}
