package io.cadence.operator;

import io.cadence.CadenceException;
import io.cadence.generator.AbstractOccurrenceCursor;
import io.cadence.generator.OccurrenceCursor;
import io.cadence.generator.OccurrenceGenerator;
import io.cadence.generator.Operator;
import io.cadence.generator.OperatorConfig;
import io.cadence.generator.RunArgs;
import io.cadence.time.DateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The dates that occur in every input stream and the base.
 *
 * <p>Once a date is found in every input, each input's further copies of that date are emitted as
 * well. When the inputs disagree, the lagging ones skip to the furthest head; if they still have
 * not met after {@code maxFailedIterations} attempts the traversal fails with a
 * {@link io.cadence.ErrorKind#NON_CONVERGENCE} error, since two infinite inputs that never align
 * would otherwise be searched forever.
 */
public final class IntersectionOperator extends Operator {
  private static final Logger log = LoggerFactory.getLogger(IntersectionOperator.class);

  private final int maxFailedIterations;

  public IntersectionOperator(
      int maxFailedIterations, List<OccurrenceGenerator> streams, OperatorConfig config) {
    super(streams, config);
    if (maxFailedIterations < 1) {
      throw CadenceException.config("maxFailedIterations must be at least 1");
    }
    this.maxFailedIterations = maxFailedIterations;
  }

  public int maxFailedIterations() {
    return maxFailedIterations;
  }

  @Override
  protected IntersectionOperator rebuild(
      List<OccurrenceGenerator> streams, OperatorConfig config) {
    return new IntersectionOperator(maxFailedIterations, streams, config);
  }

  @Override
  public boolean isInfinite() {
    List<OccurrenceGenerator> inputs = inputs();
    return !inputs.isEmpty() && inputs.stream().allMatch(OccurrenceGenerator::isInfinite);
  }

  @Override
  public boolean hasDuration() {
    List<OccurrenceGenerator> inputs = inputs();
    return !inputs.isEmpty() && inputs.stream().allMatch(OccurrenceGenerator::hasDuration);
  }

  @Override
  protected OccurrenceCursor open(RunArgs args) {
    List<OccurrenceGenerator> inputs = inputs();
    if (inputs.isEmpty()) {
      return AbstractOccurrenceCursor.empty(args);
    }
    RunArgs upstream = args.withTake(null);
    return new AbstractOccurrenceCursor(args) {
      private List<StreamNode> nodes;
      private StreamNode selected;
      private DateTime lastValid;

      @Override
      protected Optional<DateTime> advance(DateTime skipTo) {
        if (nodes == null) {
          nodes = inputs.stream().map(input -> new StreamNode(input, upstream)).toList();
        }
        if (selected != null) {
          selected.pick();
          selected = null;
        }
        if (skipTo != null) {
          nodes.forEach(node -> node.skipTo(skipTo));
        }

        int failures = 0;
        while (true) {
          if (nodes.stream().anyMatch(StreamNode::done)) {
            // Only copies of the last common date can still be part of the intersection.
            for (StreamNode node : nodes) {
              if (!node.done() && lastValid != null && node.value().isEqual(lastValid)) {
                selected = node;
                return Optional.of(node.value());
              }
            }
            return Optional.empty();
          }

          StreamNode first = nodes.get(0);
          StreamNode furthest = nodes.get(0);
          for (StreamNode node : nodes) {
            if (node.precedes(node.value(), first.value())) {
              first = node;
            }
            if (node.precedes(furthest.value(), node.value())) {
              furthest = node;
            }
          }

          DateTime head = first.value();
          if (lastValid != null && head.isEqual(lastValid)) {
            selected = first;
            return Optional.of(head);
          }
          if (nodes.stream().allMatch(node -> node.value().isEqual(head))) {
            lastValid = head;
            selected = first;
            return Optional.of(head);
          }

          if (++failures > maxFailedIterations) {
            throw CadenceException.nonConvergence(
                "intersection inputs did not align after "
                    + maxFailedIterations
                    + " attempts, last candidate "
                    + head,
                head);
          }
          DateTime target = furthest.value();
          log.debug("Intersection inputs disagree at {}, skipping to {}", head, target);
          for (StreamNode node : nodes) {
            node.skipTo(target);
          }
        }
      }
    };
  }
}
