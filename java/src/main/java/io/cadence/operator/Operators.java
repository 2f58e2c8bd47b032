package io.cadence.operator;

import io.cadence.CadenceConfig;
import io.cadence.generator.OccurrenceGenerator;
import io.cadence.time.DateTime;
import java.util.List;
import java.util.function.Function;

/**
 * Operator functions for {@link OccurrenceStream}.
 *
 * <pre>{@code
 * OccurrenceStream schedule =
 *     OccurrenceStream.of(
 *         "UTC",
 *         Operators.add(rrules),
 *         Operators.subtract(exrules),
 *         Operators.add(rdates),
 *         Operators.subtract(exdates),
 *         Operators.unique());
 * }</pre>
 *
 * <p>Each function combines its inputs with the previous stage of the pipe.
 */
public final class Operators {
  private Operators() {}

  /** Union of the inputs and the previous stage, keeping duplicates. */
  public static OperatorFunction add(OccurrenceGenerator... streams) {
    List<OccurrenceGenerator> inputs = List.of(streams);
    return config -> new AddOperator(inputs, config);
  }

  /** The previous stage without the dates occurring in any input. */
  public static OperatorFunction subtract(OccurrenceGenerator... streams) {
    List<OccurrenceGenerator> inputs = List.of(streams);
    return config -> new SubtractOperator(inputs, config);
  }

  /**
   * Dates occurring in every input and the previous stage.
   *
   * @param maxFailedIterations realignment attempts allowed per candidate
   * @param streams the inputs
   * @return the operator function
   */
  public static OperatorFunction intersection(
      int maxFailedIterations, OccurrenceGenerator... streams) {
    List<OccurrenceGenerator> inputs = List.of(streams);
    return config -> new IntersectionOperator(maxFailedIterations, inputs, config);
  }

  /** Dates occurring in every input and the previous stage, with the default retry bound. */
  public static OperatorFunction intersection(OccurrenceGenerator... streams) {
    return intersection(CadenceConfig.defaults().intersectionMaxFailedIterations(), streams);
  }

  /** The previous stage with adjacent duplicates removed. */
  public static OperatorFunction unique() {
    return UniqueOperator::new;
  }

  /**
   * The previous stage with overlapping intervals merged.
   *
   * @param maxDuration the longest merged interval allowed, in milliseconds
   * @return the operator function
   */
  public static OperatorFunction mergeDuration(long maxDuration) {
    return config -> new MergeDurationOperator(maxDuration, config);
  }

  /**
   * The previous stage with intervals longer than {@code maxDuration} split.
   *
   * @param maxDuration the longest interval allowed, in milliseconds
   * @param splitFn splits one interval into shorter ones
   * @return the operator function
   */
  public static OperatorFunction splitDuration(
      long maxDuration, Function<DateTime, List<DateTime>> splitFn) {
    return config -> new SplitDurationOperator(maxDuration, splitFn, config);
  }
}
