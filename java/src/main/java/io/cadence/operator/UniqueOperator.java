package io.cadence.operator;

import io.cadence.generator.AbstractOccurrenceCursor;
import io.cadence.generator.OccurrenceCursor;
import io.cadence.generator.OccurrenceGenerator;
import io.cadence.generator.Operator;
import io.cadence.generator.OperatorConfig;
import io.cadence.generator.RunArgs;
import io.cadence.time.DateTime;
import java.util.List;
import java.util.Optional;

/**
 * The base stream with runs of equal dates collapsed to their first date. Dates match on timestamp
 * alone, and only adjacent dates are compared, which is enough for any sorted base.
 */
public final class UniqueOperator extends Operator {

  public UniqueOperator(OperatorConfig config) {
    super(List.of(), config);
  }

  @Override
  protected UniqueOperator rebuild(List<OccurrenceGenerator> streams, OperatorConfig config) {
    return new UniqueOperator(config);
  }

  @Override
  public boolean isInfinite() {
    return config.base() != null && config.base().isInfinite();
  }

  @Override
  public boolean hasDuration() {
    return config.base() != null && config.base().hasDuration();
  }

  @Override
  protected OccurrenceCursor open(RunArgs args) {
    OccurrenceGenerator base = config.base();
    if (base == null) {
      return AbstractOccurrenceCursor.empty(args);
    }
    RunArgs upstream = args.withTake(null);
    return new AbstractOccurrenceCursor(args) {
      private StreamNode node;

      @Override
      protected Optional<DateTime> advance(DateTime skipTo) {
        if (node == null) {
          node = new StreamNode(base, upstream);
        } else {
          DateTime last = node.value();
          node.pick();
          while (!node.done() && node.value().isEqual(last)) {
            node.pick();
          }
        }
        if (skipTo != null) {
          node.skipTo(skipTo);
        }
        return node.done() ? Optional.empty() : Optional.of(node.value());
      }
    };
  }
}
