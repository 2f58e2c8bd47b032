package io.cadence;

import io.cadence.time.DateTime;
import java.util.Optional;

/**
 * Exception thrown for invalid rule configuration, mismatched date comparisons, and traversals that
 * fail to converge.
 *
 * <p>Errors raised during a traversal surface from the pull that triggered them, so this exception
 * is unchecked.
 */
public final class CadenceException extends RuntimeException {
  /** The error kind. */
  private final ErrorKind kind;

  /** The last candidate examined before a non-convergence error, if any. */
  private final DateTime lastCandidate;

  private CadenceException(ErrorKind kind, String message, DateTime lastCandidate) {
    super(message);
    this.kind = kind;
    this.lastCandidate = lastCandidate;
  }

  /**
   * Creates a new configuration error.
   *
   * @param message the error message
   * @return a new CadenceException for a configuration error
   */
  public static CadenceException config(String message) {
    return new CadenceException(ErrorKind.CONFIG, message, null);
  }

  /**
   * Creates a new comparison error for two dates with different timezone labels.
   *
   * @param left the timezone of the receiver
   * @param right the timezone of the argument
   * @return a new CadenceException for a comparison error
   */
  public static CadenceException comparison(String left, String right) {
    return new CadenceException(
        ErrorKind.COMPARISON,
        "cannot compare dates with different timezones: " + left + " and " + right,
        null);
  }

  /**
   * Creates a new non-convergence error.
   *
   * @param message the error message
   * @param lastCandidate the last candidate examined, may be null
   * @return a new CadenceException for a non-convergence error
   */
  public static CadenceException nonConvergence(String message, DateTime lastCandidate) {
    return new CadenceException(ErrorKind.NON_CONVERGENCE, message, lastCandidate);
  }

  /**
   * Creates a new invalid date error.
   *
   * @param message the error message
   * @return a new CadenceException for an invalid date error
   */
  public static CadenceException invalidDate(String message) {
    return new CadenceException(ErrorKind.INVALID_DATE, message, null);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the last candidate examined before a non-convergence error, if available.
   *
   * @return the candidate, or empty if not available
   */
  public Optional<DateTime> lastCandidate() {
    return Optional.ofNullable(lastCandidate);
  }
}
