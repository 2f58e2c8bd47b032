package io.cadence.operator;

import io.cadence.CadenceException;
import io.cadence.generator.AbstractOccurrenceCursor;
import io.cadence.generator.OccurrenceCursor;
import io.cadence.generator.OccurrenceGenerator;
import io.cadence.generator.Operator;
import io.cadence.generator.OperatorConfig;
import io.cadence.generator.RunArgs;
import io.cadence.time.DateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits intervals of the base stream that are longer than {@code maxDuration}.
 *
 * <p>The split function is applied to each such interval, and again to any piece still longer than
 * the maximum. Pieces must lie within the interval they were split from and be shorter than it; a
 * split function that returns nothing or a piece as long as its input fails the traversal with a
 * {@link io.cadence.ErrorKind#NON_CONVERGENCE} error.
 */
public final class SplitDurationOperator extends Operator {
  private static final Logger log = LoggerFactory.getLogger(SplitDurationOperator.class);

  private final long maxDuration;
  private final Function<DateTime, List<DateTime>> splitFn;

  public SplitDurationOperator(
      long maxDuration, Function<DateTime, List<DateTime>> splitFn, OperatorConfig config) {
    super(List.of(), config);
    if (maxDuration <= 0) {
      throw CadenceException.config("maxDuration must be positive, got " + maxDuration);
    }
    if (splitFn == null) {
      throw CadenceException.config("splitFn is required");
    }
    this.maxDuration = maxDuration;
    this.splitFn = splitFn;
  }

  public long maxDuration() {
    return maxDuration;
  }

  @Override
  protected SplitDurationOperator rebuild(
      List<OccurrenceGenerator> streams, OperatorConfig config) {
    return new SplitDurationOperator(maxDuration, splitFn, config);
  }

  @Override
  public boolean isInfinite() {
    return config.base() != null && config.base().isInfinite();
  }

  @Override
  public boolean hasDuration() {
    return true;
  }

  @Override
  public long longestDuration() {
    return maxDuration;
  }

  @Override
  protected OccurrenceCursor open(RunArgs args) {
    OccurrenceGenerator base = config.base();
    if (base == null) {
      return AbstractOccurrenceCursor.empty(args);
    }
    if (!base.hasDuration()) {
      throw CadenceException.config("splitDuration requires a base whose dates have durations");
    }
    // Base intervals have no length limit, so one starting long before the traversal start may
    // still produce pieces inside it.
    RunArgs upstream = new RunArgs(null, args.end(), null, args.reverse());
    long longestBase = base.longestDuration();
    Comparator<DateTime> order =
        args.reverse() ? Comparator.<DateTime>naturalOrder().reversed() : Comparator.naturalOrder();

    return new AbstractOccurrenceCursor(args) {
      private StreamNode node;
      private final PriorityQueue<DateTime> buffer = new PriorityQueue<>(order);

      @Override
      protected Optional<DateTime> advance(DateTime skipTo) {
        if (node == null) {
          node = new StreamNode(base, upstream);
        }
        while (true) {
          fill();
          DateTime piece = buffer.poll();
          if (piece == null) {
            return Optional.empty();
          }
          if (!reverse && args.end() != null && piece.isAfter(args.end())) {
            return Optional.empty();
          }
          if (args.start() != null && piece.endTimestamp() < args.start().timestamp()) {
            continue;
          }
          if (args.end() != null && piece.isAfter(args.end())) {
            continue;
          }
          if (skipTo != null && precedes(piece, skipTo)) {
            continue;
          }
          return Optional.of(piece);
        }
      }

      // A base interval's pieces begin no earlier than its start and no later than its end, so
      // pulling stops once the next base interval cannot produce a piece ahead of the buffer. In
      // reverse the base arrives by descending start, and a later one may still end anywhere up to
      // longestBase past its start.
      private void fill() {
        while (!node.done()) {
          DateTime head = buffer.peek();
          boolean needed =
              head == null
                  || (reverse
                      ? node.value().timestamp() + longestBase >= head.timestamp()
                      : node.value().timestamp() <= head.timestamp());
          if (!needed) {
            return;
          }
          buffer.addAll(split(node.value()));
          node.pick();
        }
      }
    };
  }

  private List<DateTime> split(DateTime date) {
    if (date.duration() <= maxDuration) {
      return List.of(date);
    }
    List<DateTime> pieces = splitFn.apply(date);
    if (pieces == null || pieces.isEmpty()) {
      throw CadenceException.nonConvergence(
          "split function returned no pieces for " + date + " longer than " + maxDuration + "ms",
          date);
    }
    List<DateTime> result = new ArrayList<>();
    for (DateTime raw : pieces) {
      DateTime piece = raw.withTimezone(date.timezone());
      if (piece.timestamp() < date.timestamp() || piece.endTimestamp() > date.endTimestamp()) {
        throw CadenceException.config(
            "split function returned " + piece + " outside of " + date);
      }
      if (piece.duration() >= date.duration()) {
        throw CadenceException.nonConvergence(
            "split function made no progress on " + date + ", returned " + piece, date);
      }
      result.addAll(split(piece));
    }
    log.debug("Split {} into {} pieces", date, result.size());
    return result;
  }
}
