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

/** The union of the input streams and the base. Duplicates are kept. */
public final class AddOperator extends Operator {

  public AddOperator(List<OccurrenceGenerator> streams, OperatorConfig config) {
    super(streams, config);
  }

  @Override
  protected AddOperator rebuild(List<OccurrenceGenerator> streams, OperatorConfig config) {
    return new AddOperator(streams, config);
  }

  @Override
  public boolean isInfinite() {
    return inputs().stream().anyMatch(OccurrenceGenerator::isInfinite);
  }

  @Override
  public boolean hasDuration() {
    List<OccurrenceGenerator> inputs = inputs();
    return !inputs.isEmpty() && inputs.stream().allMatch(OccurrenceGenerator::hasDuration);
  }

  @Override
  protected OccurrenceCursor open(RunArgs args) {
    RunArgs upstream = args.withTake(null);
    return new AbstractOccurrenceCursor(args) {
      private List<StreamNode> nodes;
      private StreamNode selected;

      @Override
      protected Optional<DateTime> advance(DateTime skipTo) {
        if (nodes == null) {
          nodes = inputs().stream().map(input -> new StreamNode(input, upstream)).toList();
        }
        if (selected != null) {
          selected.pick();
        }
        if (skipTo != null) {
          nodes.forEach(node -> node.skipTo(skipTo));
        }
        selected = null;
        for (StreamNode node : nodes) {
          if (node.done()) {
            continue;
          }
          if (selected == null || comesFirst(node.value(), selected.value())) {
            selected = node;
          }
        }
        return selected == null ? Optional.empty() : Optional.of(selected.value());
      }

      private boolean comesFirst(DateTime a, DateTime b) {
        int order = a.compareTo(b);
        return reverse ? order > 0 : order < 0;
      }
    };
  }
}
