package io.cadence.generator;

import io.cadence.CadenceConfig;
import io.cadence.CadenceException;
import io.cadence.rule.NormalizedRuleOptions;
import io.cadence.rule.RuleOptions;
import io.cadence.rule.pipeline.ConstraintPipeline;
import io.cadence.time.DateTime;
import io.cadence.time.DateUnit;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A recurrence rule: the occurrences of a frequency, interval and set of "by" constraints, from a
 * start date up to an optional end date or count.
 *
 * <p>Options are validated on construction; an invalid rule is never built. Occurrences are
 * computed in the start date's timezone and returned in {@link #timezone()}, which defaults to the
 * same zone.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Rule rule =
 *     Rule.of(
 *         RuleOptions.of(Frequency.MONTHLY, DateTime.of(2019, 1, 1, 9, 0, 0, 0, "UTC"))
 *             .withByDayOfWeek(List.of(ByDayOfWeek.of(Weekday.MO, -1)))
 *             .withCount(12));
 * Optional<DateTime> last = rule.lastDate();
 * }</pre>
 */
public final class Rule extends OccurrenceGenerator {
  private static final Logger log = LoggerFactory.getLogger(Rule.class);

  private final RuleOptions options;
  private final NormalizedRuleOptions normalized;
  private final CadenceConfig config;
  private final String timezone;

  private Rule(
      RuleOptions options,
      NormalizedRuleOptions normalized,
      CadenceConfig config,
      String timezone) {
    this.options = options;
    this.normalized = normalized;
    this.config = config;
    this.timezone = timezone;
  }

  /**
   * Creates a rule with the default configuration.
   *
   * @param options the rule options
   * @return the rule
   * @throws CadenceException if the options are invalid
   */
  public static Rule of(RuleOptions options) {
    return of(options, CadenceConfig.defaults());
  }

  /**
   * Creates a rule.
   *
   * @param options the rule options
   * @param config the engine configuration
   * @return the rule
   * @throws CadenceException if the options are invalid
   */
  public static Rule of(RuleOptions options, CadenceConfig config) {
    NormalizedRuleOptions normalized = NormalizedRuleOptions.normalize(options, config);
    log.debug("Normalized rule options: {}", normalized);
    return new Rule(options, normalized, config, normalized.start().timezone());
  }

  /**
   * Returns the options as provided.
   *
   * @return the provided options
   */
  public RuleOptions options() {
    return options;
  }

  /**
   * Returns the validated options with all implicit constraints filled in.
   *
   * @return the normalized options
   */
  public NormalizedRuleOptions normalizedOptions() {
    return normalized;
  }

  public CadenceConfig config() {
    return config;
  }

  /**
   * Returns a new rule with other options and the same output timezone.
   *
   * @param options the new options
   * @return the new rule
   * @throws CadenceException if the options are invalid
   */
  public Rule withOptions(RuleOptions options) {
    NormalizedRuleOptions next = NormalizedRuleOptions.normalize(options, config);
    return new Rule(options, next, config, timezone);
  }

  @Override
  public String timezone() {
    return timezone;
  }

  @Override
  public Rule withTimezone(String timezone) {
    if (Objects.equals(this.timezone, timezone)) {
      return this;
    }
    return new Rule(options, normalized, config, timezone);
  }

  @Override
  public boolean isInfinite() {
    return normalized.isInfinite();
  }

  @Override
  public boolean hasDuration() {
    return normalized.duration() > 0;
  }

  @Override
  public long longestDuration() {
    return normalized.duration();
  }

  @Override
  protected OccurrenceCursor open(RunArgs args) {
    RunArgs local = args.withTimezone(normalized.start().timezone());
    return local.reverse() ? reverseCursor(local) : new ForwardCursor(local);
  }

  private OccurrenceCursor reverseCursor(RunArgs args) {
    DateTime upper = earliest(normalized.end(), args.end());
    if (normalized.count() != null) {
      Optional<DateTime> last = lastCountedOccurrence();
      if (last.isEmpty()) {
        return AbstractOccurrenceCursor.empty(args);
      }
      upper = earliest(upper, last.get());
    }
    if (upper == null) {
      throw CadenceException.config(
          "cannot iterate an infinite rule in reverse without an end date");
    }
    return new ReverseCursor(args, upper);
  }

  private Optional<DateTime> lastCountedOccurrence() {
    ForwardCursor forward = new ForwardCursor(RunArgs.all());
    while (forward.next().isPresent()) {
      // exhaust the count
    }
    return Optional.ofNullable(forward.last);
  }

  private DateTime toLocal(DateTime date) {
    return date == null ? null : date.withTimezone(normalized.start().timezone());
  }

  private DateTime output(DateTime date) {
    DateTime withDuration =
        normalized.duration() > 0 ? date.withDuration(normalized.duration()) : date;
    return withDuration.withTimezone(timezone);
  }

  private static DateTime earliest(DateTime a, DateTime b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.isBefore(b) ? a : b;
  }

  private static DateTime latest(DateTime a, DateTime b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return a.isAfter(b) ? a : b;
  }

  /**
   * Walks occurrences from the rule start. With a count, every occurrence from the start is
   * counted, including those before the traversal's start or a skip date, so skipping never
   * changes which occurrences the count admits.
   */
  private final class ForwardCursor extends AbstractOccurrenceCursor {
    private final ConstraintPipeline pipeline =
        ConstraintPipeline.of(normalized, false, config.maxFailedIterations());
    private final DateTime lower;
    private final DateTime upper;
    private DateTime candidate;
    private DateTime last;
    private int generated;

    ForwardCursor(RunArgs args) {
      super(args);
      this.lower = latest(normalized.start(), args.start());
      this.upper = earliest(normalized.end(), args.end());
      this.candidate = normalized.count() == null ? lower : normalized.start();
    }

    @Override
    protected Optional<DateTime> advance(DateTime hint) {
      DateTime skipTo = toLocal(hint);
      DateTime from = candidate;
      if (skipTo != null && normalized.count() == null && skipTo.isAfter(from)) {
        from = skipTo;
      }
      while (true) {
        Optional<DateTime> found = pipeline.resolve(from, upper);
        if (found.isEmpty()) {
          return Optional.empty();
        }
        DateTime date = found.get();
        generated++;
        candidate = date.add(1, DateUnit.MILLISECOND);
        if (normalized.count() != null && generated > normalized.count()) {
          return Optional.empty();
        }
        if (date.isBefore(lower) || (skipTo != null && date.isBefore(skipTo))) {
          from = candidate;
          continue;
        }
        last = date;
        return Optional.of(output(date));
      }
    }
  }

  /** Walks occurrences backwards from {@code upper} down to the rule or traversal start. */
  private final class ReverseCursor extends AbstractOccurrenceCursor {
    private final ConstraintPipeline pipeline =
        ConstraintPipeline.of(normalized, true, config.maxFailedIterations());
    private final DateTime lower;
    private DateTime candidate;

    ReverseCursor(RunArgs args, DateTime upper) {
      super(args);
      this.lower = latest(normalized.start(), args.start());
      this.candidate = upper;
    }

    @Override
    protected Optional<DateTime> advance(DateTime hint) {
      DateTime skipTo = toLocal(hint);
      DateTime from = candidate;
      if (skipTo != null && skipTo.isBefore(from)) {
        from = skipTo;
      }
      Optional<DateTime> found = pipeline.resolve(from, lower);
      found.ifPresent(date -> candidate = date.subtract(1, DateUnit.MILLISECOND));
      return found.map(Rule.this::output);
    }
  }
}
