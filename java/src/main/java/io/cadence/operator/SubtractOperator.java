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
 * The base stream without any date that also occurs in one of the input streams. Dates match on
 * timestamp alone. Without a base the result is empty.
 */
public final class SubtractOperator extends Operator {

  public SubtractOperator(List<OccurrenceGenerator> streams, OperatorConfig config) {
    super(streams, config);
  }

  @Override
  protected SubtractOperator rebuild(List<OccurrenceGenerator> streams, OperatorConfig config) {
    return new SubtractOperator(streams, config);
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
      private StreamNode included;
      private List<StreamNode> excluded;

      @Override
      protected Optional<DateTime> advance(DateTime skipTo) {
        if (included == null) {
          included = new StreamNode(base, upstream);
          excluded = streams.stream().map(stream -> new StreamNode(stream, upstream)).toList();
        } else {
          included.pick();
        }
        if (skipTo != null) {
          included.skipTo(skipTo);
        }
        while (!included.done()) {
          DateTime candidate = included.value();
          if (!isExcluded(candidate)) {
            return Optional.of(candidate);
          }
          included.pick();
        }
        return Optional.empty();
      }

      private boolean isExcluded(DateTime candidate) {
        boolean found = false;
        for (StreamNode node : excluded) {
          node.skipTo(candidate);
          if (!node.done() && node.value().isEqual(candidate)) {
            found = true;
          }
        }
        return found;
      }
    };
  }
}
