package io.cadence;

import io.cadence.time.Weekday;

/**
 * Engine-wide settings shared by rules and operators.
 *
 * @param defaultWeekStart the week start used by rules that do not declare one
 * @param maxFailedIterations consecutive pipeline repairs allowed before a rule fails to converge
 * @param intersectionMaxFailedIterations realignment attempts allowed per intersection candidate
 */
public record CadenceConfig(
    Weekday defaultWeekStart, int maxFailedIterations, int intersectionMaxFailedIterations) {

  /** The default number of iterations for both the pipeline and intersection guards. */
  public static final int DEFAULT_MAX_FAILED_ITERATIONS = 50;

  private static final CadenceConfig DEFAULTS =
      new CadenceConfig(
          Weekday.MO, DEFAULT_MAX_FAILED_ITERATIONS, DEFAULT_MAX_FAILED_ITERATIONS);

  public CadenceConfig {
    if (defaultWeekStart == null) {
      throw CadenceException.config("defaultWeekStart is required");
    }
    if (maxFailedIterations < 1) {
      throw CadenceException.config("maxFailedIterations must be at least 1");
    }
    if (intersectionMaxFailedIterations < 1) {
      throw CadenceException.config("intersectionMaxFailedIterations must be at least 1");
    }
  }

  /**
   * Returns the default configuration: weeks start on Monday and both guards allow 50 iterations.
   *
   * @return the default configuration
   */
  public static CadenceConfig defaults() {
    return DEFAULTS;
  }

  public CadenceConfig withDefaultWeekStart(Weekday weekStart) {
    return new CadenceConfig(weekStart, maxFailedIterations, intersectionMaxFailedIterations);
  }

  public CadenceConfig withMaxFailedIterations(int max) {
    return new CadenceConfig(defaultWeekStart, max, intersectionMaxFailedIterations);
  }

  public CadenceConfig withIntersectionMaxFailedIterations(int max) {
    return new CadenceConfig(defaultWeekStart, maxFailedIterations, max);
  }
}
