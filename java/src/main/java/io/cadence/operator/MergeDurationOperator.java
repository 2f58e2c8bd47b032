package io.cadence.operator;

import io.cadence.CadenceException;
import io.cadence.generator.AbstractOccurrenceCursor;
import io.cadence.generator.OccurrenceCursor;
import io.cadence.generator.OccurrenceGenerator;
import io.cadence.generator.Operator;
import io.cadence.generator.OperatorConfig;
import io.cadence.generator.RunArgs;
import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges overlapping or touching intervals of the base stream into single intervals.
 *
 * <p>An interval is kept when it ends at or after the traversal's start and begins at or before its
 * end. A merged interval longer than {@code maxDuration} fails the traversal with a
 * {@link io.cadence.ErrorKind#NON_CONVERGENCE} error.
 */
public final class MergeDurationOperator extends Operator {
  private static final Logger log = LoggerFactory.getLogger(MergeDurationOperator.class);

  private final long maxDuration;

  public MergeDurationOperator(long maxDuration, OperatorConfig config) {
    super(List.of(), config);
    if (maxDuration <= 0) {
      throw CadenceException.config("maxDuration must be positive, got " + maxDuration);
    }
    this.maxDuration = maxDuration;
  }

  public long maxDuration() {
    return maxDuration;
  }

  @Override
  protected MergeDurationOperator rebuild(
      List<OccurrenceGenerator> streams, OperatorConfig config) {
    return new MergeDurationOperator(maxDuration, config);
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
      throw CadenceException.config("mergeDuration requires a base whose dates have durations");
    }
    // A valid merged interval touching [start, end] has every member within maxDuration of it.
    // Reading one more maxDuration on each side also reaches the member that chains an oversized
    // interval into the window, so a violation is reported instead of truncated.
    RunArgs upstream =
        new RunArgs(
            args.start() == null
                ? null
                : args.start().subtract(2 * maxDuration, DateUnit.MILLISECOND),
            args.end() == null ? null : args.end().add(2 * maxDuration, DateUnit.MILLISECOND),
            null,
            args.reverse());

    return new AbstractOccurrenceCursor(args) {
      private StreamNode node;
      private final List<DateTime> lookahead = new ArrayList<>();

      @Override
      protected Optional<DateTime> advance(DateTime skipTo) {
        if (node == null) {
          node = new StreamNode(base, upstream);
        }
        while (true) {
          Optional<DateTime> next = reverse ? nextReverse() : nextForward();
          if (next.isEmpty()) {
            return next;
          }
          DateTime merged = next.get();
          if (!reverse && args.end() != null && merged.isAfter(args.end())) {
            return Optional.empty();
          }
          if (reverse
              && args.start() != null
              && merged.endTimestamp() < args.start().timestamp()) {
            return Optional.empty();
          }
          if (!withinBounds(merged) || (skipTo != null && precedes(merged, skipTo))) {
            continue;
          }
          return next;
        }
      }

      private boolean withinBounds(DateTime merged) {
        if (args.start() != null && merged.endTimestamp() < args.start().timestamp()) {
          return false;
        }
        return args.end() == null || !merged.isAfter(args.end());
      }

      private Optional<DateTime> nextForward() {
        if (node.done()) {
          return Optional.empty();
        }
        DateTime merged = checked(node.value());
        node.pick();
        int members = 1;
        while (!node.done() && node.value().timestamp() <= merged.endTimestamp()) {
          merged = extend(merged, merged.timestamp(), node.value().endTimestamp());
          node.pick();
          members++;
        }
        if (members > 1) {
          log.debug("Merged {} intervals into {}", members, merged);
        }
        return Optional.of(merged);
      }

      // In reverse, intervals arrive latest start first, so an earlier interval reaching into the
      // current one may be preceded by intervals that do not; those wait in the lookahead.
      private Optional<DateTime> nextReverse() {
        DateTime latest = takeLatest();
        if (latest == null) {
          return Optional.empty();
        }
        DateTime merged = checked(latest);
        int members = 1;
        boolean extended = true;
        while (extended) {
          long reach = merged.timestamp() - maxDuration;
          while (!node.done() && node.value().timestamp() >= reach) {
            lookahead.add(node.value());
            node.pick();
          }
          extended = false;
          for (int i = 0; i < lookahead.size(); i++) {
            DateTime candidate = lookahead.get(i);
            if (candidate.endTimestamp() >= merged.timestamp()) {
              merged = extend(merged, candidate.timestamp(), candidate.endTimestamp());
              lookahead.remove(i);
              members++;
              extended = true;
              break;
            }
          }
        }
        if (members > 1) {
          log.debug("Merged {} intervals into {}", members, merged);
        }
        return Optional.of(merged);
      }

      private DateTime takeLatest() {
        if (lookahead.isEmpty()) {
          if (node.done()) {
            return null;
          }
          DateTime value = node.value();
          node.pick();
          return value;
        }
        int latest = 0;
        for (int i = 1; i < lookahead.size(); i++) {
          if (lookahead.get(i).compareTo(lookahead.get(latest)) > 0) {
            latest = i;
          }
        }
        return lookahead.remove(latest);
      }

      private DateTime checked(DateTime date) {
        return extend(date, date.timestamp(), date.endTimestamp());
      }

      private DateTime extend(DateTime merged, long otherStart, long otherEnd) {
        long start = Math.min(merged.timestamp(), otherStart);
        long end = Math.max(merged.endTimestamp(), otherEnd);
        if (end - start > maxDuration) {
          throw CadenceException.nonConvergence(
              "merged duration of "
                  + (end - start)
                  + "ms starting at "
                  + merged
                  + " exceeds the maximum of "
                  + maxDuration
                  + "ms",
              merged);
        }
        return DateTime.ofEpochMillis(start, merged.timezone()).withDuration(end - start);
      }
    };
  }
}
