package io.cadence.operator;

import io.cadence.generator.AbstractOccurrenceCursor;
import io.cadence.generator.OccurrenceCursor;
import io.cadence.generator.OccurrenceGenerator;
import io.cadence.generator.Operator;
import io.cadence.generator.OperatorConfig;
import io.cadence.generator.RunArgs;
import java.util.List;

/**
 * A pipe of operators, each taking the previous one as its base. The stream's occurrences are those
 * of the last operator.
 *
 * <p>Order matters: {@code add(a), subtract(b), add(c)} removes {@code b} from {@code a} but keeps
 * every date of {@code c}.
 */
public final class OccurrenceStream extends Operator {
  private final List<OperatorFunction> operators;
  private final Operator last;

  private OccurrenceStream(List<OperatorFunction> operators, String timezone) {
    super(List.of(), OperatorConfig.of(timezone));
    this.operators = List.copyOf(operators);
    Operator previous = null;
    for (OperatorFunction operator : this.operators) {
      previous = operator.apply(new OperatorConfig(timezone, previous));
    }
    this.last = previous;
  }

  /**
   * Creates a pipe.
   *
   * @param timezone the timezone every stage runs in, or null
   * @param operators the stages, first to last
   * @return the pipe
   */
  public static OccurrenceStream of(String timezone, OperatorFunction... operators) {
    return new OccurrenceStream(List.of(operators), timezone);
  }

  public static OccurrenceStream of(String timezone, List<OperatorFunction> operators) {
    return new OccurrenceStream(operators, timezone);
  }

  public List<OperatorFunction> operators() {
    return operators;
  }

  @Override
  protected OccurrenceStream rebuild(List<OccurrenceGenerator> streams, OperatorConfig config) {
    return new OccurrenceStream(operators, config.timezone());
  }

  @Override
  public boolean isInfinite() {
    return last != null && last.isInfinite();
  }

  @Override
  public boolean hasDuration() {
    return last != null && last.hasDuration();
  }

  @Override
  public long longestDuration() {
    return last == null ? 0 : last.longestDuration();
  }

  @Override
  protected OccurrenceCursor open(RunArgs args) {
    return last == null ? AbstractOccurrenceCursor.empty(args) : last.cursor(args);
  }
}
