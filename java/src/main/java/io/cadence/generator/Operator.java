package io.cadence.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A generator composing other generators: its input streams and, inside an operator pipe, the
 * previous stage of the pipe (its base).
 *
 * <p>Inputs are converted to the operator's timezone on construction, so every comparison an
 * operator makes is between dates with the same label.
 */
public abstract non-sealed class Operator extends OccurrenceGenerator {
  protected final List<OccurrenceGenerator> streams;
  protected final OperatorConfig config;

  protected Operator(List<OccurrenceGenerator> streams, OperatorConfig config) {
    this.config = config.withTimezone(config.timezone());
    List<OccurrenceGenerator> converted = new ArrayList<>(streams.size());
    for (OccurrenceGenerator stream : streams) {
      converted.add(stream.withTimezone(config.timezone()));
    }
    this.streams = List.copyOf(converted);
  }

  /**
   * Rebuilds this operator with other inputs and config.
   *
   * @param streams the input streams
   * @param config the config
   * @return the new operator
   */
  protected abstract Operator rebuild(List<OccurrenceGenerator> streams, OperatorConfig config);

  public List<OccurrenceGenerator> streams() {
    return streams;
  }

  public Optional<OccurrenceGenerator> base() {
    return Optional.ofNullable(config.base());
  }

  @Override
  public String timezone() {
    return config.timezone();
  }

  @Override
  public Operator withTimezone(String timezone) {
    if (Objects.equals(config.timezone(), timezone)) {
      return this;
    }
    return rebuild(streams, config.withTimezone(timezone));
  }

  /** Operators that only select or combine input dates are bounded by their longest input. */
  @Override
  public long longestDuration() {
    return inputs().stream().mapToLong(OccurrenceGenerator::longestDuration).max().orElse(0);
  }

  /**
   * Returns the inputs followed by the base, if any.
   *
   * @return every upstream generator
   */
  protected List<OccurrenceGenerator> inputs() {
    List<OccurrenceGenerator> inputs = new ArrayList<>(streams);
    if (config.base() != null) {
      inputs.add(config.base());
    }
    return inputs;
  }
}
