package io.cadence.generator;

/**
 * Settings every operator is built with.
 *
 * @param timezone the timezone the operator and its inputs run in
 * @param base the previous stage of an operator pipe, or null
 */
public record OperatorConfig(String timezone, OccurrenceGenerator base) {
  public static OperatorConfig of(String timezone) {
    return new OperatorConfig(timezone, null);
  }

  public OperatorConfig withBase(OccurrenceGenerator base) {
    return new OperatorConfig(timezone, base);
  }

  /**
   * Returns a config in another timezone, converting the base to it.
   *
   * @param timezone the timezone label, or null
   * @return the new config
   */
  public OperatorConfig withTimezone(String timezone) {
    return new OperatorConfig(timezone, base == null ? null : base.withTimezone(timezone));
  }
}
